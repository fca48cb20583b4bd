package com.sqlpush.translator.rules;

import com.sqlpush.expression.CaseWhenExpression;
import com.sqlpush.expression.CastExpression;
import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.expression.IfExpression;
import com.sqlpush.expression.InExpression;
import com.sqlpush.expression.LikeExpression;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.translator.ExpressionTranslator;
import com.sqlpush.translator.TypeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Conditionals, predicates and casts.
 *
 * <ul>
 *   <li>{@code IF(p, t, f)}, also for the {@code if} function</li>
 *   <li>{@code nvl2(a, b, c)} → {@code IF(a IS NOT NULL, b, c)}</li>
 *   <li>{@code (CASE WHEN c THEN r ... [ELSE e] END)}; one untranslatable branch fails the whole CASE</li>
 *   <li>{@code (v IN (a, b))} and {@code (v NOT IN (a, b))}</li>
 *   <li>{@code (l LIKE r)}; a non-default escape character is rewritten to a backslash inside r</li>
 *   <li>{@code (l RLIKE CONCAT('^', r))}, anchoring the regex like the host's find-from-start</li>
 *   <li>{@code CAST(x AS T)}</li>
 * </ul>
 */
public final class ConditionalRule implements TranslationRule {

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (expression instanceof IfExpression conditional) {
            return ifFunction(conditional.predicate(), conditional.trueValue(), conditional.falseValue(), translator);
        }
        if (expression instanceof FunctionCall call) {
            if (call.is("if", 3)) {
                return ifFunction(call.argument(0), call.argument(1), call.argument(2), translator);
            }
            if (call.is("nvl2", 3)) {
                return RuleSupport.arguments(call, translator).map(args -> Sql.func("IF",
                    Sql.keywords(args.get(0), "IS NOT NULL"), args.get(1), args.get(2)));
            }
            return Optional.empty();
        }
        if (expression instanceof CaseWhenExpression caseWhen) {
            return caseWhen(caseWhen, translator);
        }
        if (expression instanceof InExpression in) {
            return in(in, translator);
        }
        if (expression instanceof LikeExpression like) {
            return like(like, translator);
        }
        if (expression instanceof CastExpression cast) {
            Optional<String> target = TypeMapper.toCastTarget(cast.targetType());
            if (target.isEmpty()) {
                return Optional.empty();
            }
            return translator.translate(cast.expression())
                .map(child -> Sql.func("CAST", Sql.keywords(child, "AS", target.get())));
        }
        return Optional.empty();
    }

    private static Optional<Fragment> ifFunction(Expression predicate, Expression trueValue, Expression falseValue,
                                                 ExpressionTranslator translator) {
        return translator.translateEach(List.of(predicate, trueValue, falseValue))
            .map(args -> Sql.func("IF", args));
    }

    private static Optional<Fragment> caseWhen(CaseWhenExpression caseWhen, ExpressionTranslator translator) {
        List<Fragment> parts = new ArrayList<>();
        parts.add(Fragment.raw("CASE"));
        for (CaseWhenExpression.Branch branch : caseWhen.branches()) {
            Optional<Fragment> condition = translator.translate(branch.condition());
            Optional<Fragment> result = translator.translate(branch.value());
            if (condition.isEmpty() || result.isEmpty()) {
                return Optional.empty();
            }
            parts.add(Sql.keywords("WHEN", condition.get(), "THEN", result.get()));
        }
        if (caseWhen.elseBranch().isPresent()) {
            Optional<Fragment> otherwise = translator.translate(caseWhen.elseBranch().get());
            if (otherwise.isEmpty()) {
                return Optional.empty();
            }
            parts.add(Sql.keywords("ELSE", otherwise.get()));
        }
        parts.add(Fragment.raw("END"));
        return Optional.of(Fragment.parenthesize(Fragment.join(parts, " ")));
    }

    private static Optional<Fragment> in(InExpression in, ExpressionTranslator translator) {
        if (in.values().isEmpty()) {
            return Optional.empty();
        }
        Optional<Fragment> value = translator.translate(in.testExpr());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        String operator = in.negated() ? "NOT IN" : "IN";
        return translator.translateAll(in.values())
            .map(values -> Sql.op(operator, value.get(), Fragment.parenthesize(values)));
    }

    private static Optional<Fragment> like(LikeExpression like, ExpressionTranslator translator) {
        Optional<Fragment> value = translator.translate(like.value());
        Optional<Fragment> pattern = translator.translate(like.pattern());
        if (value.isEmpty() || pattern.isEmpty()) {
            return Optional.empty();
        }
        if (like.kind() == LikeExpression.Kind.RLIKE) {
            return Optional.of(Sql.op("RLIKE", value.get(),
                Sql.func("CONCAT", RuleSupport.string("^"), pattern.get())));
        }
        if (like.escapeChar() == LikeExpression.DEFAULT_ESCAPE) {
            return Optional.of(Sql.op("LIKE", value.get(), pattern.get()));
        }
        Fragment escaped = Sql.func("REPLACE", pattern.get(),
            RuleSupport.string(String.valueOf(like.escapeChar())), Fragment.raw("'\\\\'"));
        return Optional.of(Sql.op("LIKE", value.get(), escaped));
    }
}
