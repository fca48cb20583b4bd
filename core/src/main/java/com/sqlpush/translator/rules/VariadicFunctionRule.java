package com.sqlpush.translator.rules;

import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.translator.ExpressionTranslator;

import java.util.Map;
import java.util.Optional;

/**
 * Functions taking any number (at least one) of arguments, rendered as the
 * same-named remote function over all arguments.
 */
public final class VariadicFunctionRule implements TranslationRule {

    private static final Map<String, String> VARIADIC = Map.of(
        "coalesce", "COALESCE",
        "least", "LEAST",
        "greatest", "GREATEST",
        "concat", "CONCAT",
        "concat_ws", "CONCAT_WS",
        "decode", "DECODE"
    );

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (!(expression instanceof FunctionCall call) || call.argumentCount() == 0) {
            return Optional.empty();
        }
        String name = VARIADIC.get(call.normalizedName());
        if (name == null) {
            return Optional.empty();
        }
        return RuleSupport.arguments(call, translator).map(args -> Sql.func(name, args));
    }
}
