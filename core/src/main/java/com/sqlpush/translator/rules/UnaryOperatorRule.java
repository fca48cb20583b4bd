package com.sqlpush.translator.rules;

import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.expression.UnaryExpression;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.functions.FunctionRegistry;
import com.sqlpush.functions.FunctionTranslator;
import com.sqlpush.literal.LiteralEncoder;
import com.sqlpush.translator.ExpressionTranslator;
import com.sqlpush.types.DecimalType;
import com.sqlpush.types.StringType;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Unary operators and one-argument functions.
 *
 * <p>Operators:
 * <pre>
 *   -x           → -(x)
 *   +x           → +(x)
 *   ~x           → ~(x)
 *   NOT x        → (NOT x)
 *   x IS NULL    → (x) IS NULL
 * </pre>
 *
 * <p>Decimal helpers of the host's aggregate optimizer are supported:
 * {@code unscaled_value(d)} multiplies by 10^scale and converts to BIGINT,
 * {@code make_decimal(l)} divides by 10^scale and casts to the result type,
 * {@code promote_precision(d)} is rendered as its child.
 */
public final class UnaryOperatorRule implements TranslationRule {

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (expression instanceof UnaryExpression unary) {
            return translator.translate(unary.operand()).map(operand -> operator(unary.operator(), operand));
        }
        if (expression instanceof FunctionCall call && call.argumentCount() == 1) {
            return function(call, translator);
        }
        return Optional.empty();
    }

    private static Fragment operator(UnaryExpression.Operator operator, Fragment operand) {
        switch (operator) {
            case NEGATE:
            case POSITIVE:
            case BITWISE_NOT:
                return Sql.func(operator.symbol(), operand);
            case NOT:
                return Fragment.parenthesize(Sql.keywords("NOT", operand));
            case IS_NULL:
            case IS_NOT_NULL:
                return Sql.keywords(Fragment.parenthesize(operand), operator.symbol());
            default:
                throw new IllegalStateException("Unknown unary operator: " + operator);
        }
    }

    private static Optional<Fragment> function(FunctionCall call, ExpressionTranslator translator) {
        Expression argument = call.argument(0);
        switch (call.normalizedName()) {
            case "promote_precision":
                return translator.translate(argument);
            case "unscaled_value":
                return unscaledValue(argument, translator);
            case "make_decimal":
                return makeDecimal(call, translator);
            case "reverse":
                // REVERSE is string-only remotely; the host also reverses arrays
                if (!(argument.dataType() instanceof StringType)) {
                    return Optional.empty();
                }
                return translator.translate(argument).map(s -> Sql.func("REVERSE", s));
            case "from_unixtime":
                return translator.translate(argument).map(s -> Sql.func("FROM_UNIXTIME", s));
            case "to_timestamp":
                if (!(argument.dataType() instanceof StringType)) {
                    return Optional.empty();
                }
                return translator.translate(argument).map(s -> Sql.func("TIMESTAMP", s));
            case "to_date":
                if (!(argument.dataType() instanceof StringType)) {
                    return Optional.empty();
                }
                return translator.translate(argument).map(s -> Sql.func("DATE", s));
            default:
                Optional<FunctionTranslator> function = FunctionRegistry.lookup(call.functionName(), 1);
                if (function.isEmpty()) {
                    return Optional.empty();
                }
                return RuleSupport.arguments(call, translator).map(args -> function.get().translate(args));
        }
    }

    // ((d * 10^s) !:> BIGINT)
    private static Optional<Fragment> unscaledValue(Expression argument, ExpressionTranslator translator) {
        if (!(argument.dataType() instanceof DecimalType decimal)) {
            return Optional.empty();
        }
        return translator.translate(argument).map(d -> Sql.op("!:>",
            Sql.op("*", d, powerOfTen(decimal.scale())), Fragment.raw("BIGINT")));
    }

    // CAST((l / 10^s) AS DECIMAL(p, s))
    private static Optional<Fragment> makeDecimal(FunctionCall call, ExpressionTranslator translator) {
        if (!(call.dataType() instanceof DecimalType decimal)) {
            return Optional.empty();
        }
        DecimalType target = LiteralEncoder.clamp(decimal);
        return translator.translate(call.argument(0)).map(l -> Sql.func("CAST", Sql.keywords(
            Sql.op("/", l, powerOfTen(decimal.scale())),
            "AS", "DECIMAL(" + target.precision() + ", " + target.scale() + ")")));
    }

    private static Fragment powerOfTen(int scale) {
        return Fragment.raw(BigDecimal.TEN.pow(scale).toPlainString());
    }
}
