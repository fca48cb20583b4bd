package com.sqlpush.translator.rules;

import com.sqlpush.expression.AggregateExpression;
import com.sqlpush.expression.Expression;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.translator.DialectLimits;
import com.sqlpush.translator.ExpressionTranslator;
import com.sqlpush.translator.TranslationContext;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Aggregate functions.
 *
 * <p>The remote dialect has no {@code FILTER (WHERE ...)} clause, so a
 * filtered aggregate {@code F(x) FILTER (WHERE c)} is emitted as
 * {@code F(IF(c, x, NULL))}, relying on aggregates skipping NULL inputs.
 * {@code COUNT(DISTINCT ...)} cannot be combined with a filter this way and
 * is left untranslated when filtered. MIN and MAX ignore DISTINCT; on any
 * other aggregate it is not supported.
 *
 * <p>BIT_AND, BIT_OR and BIT_XOR require dialect version 7.0.1.
 */
public final class AggregateRule implements TranslationRule {

    private static final Map<String, String> AGGREGATES = new HashMap<>();
    private static final Map<String, String> BIT_AGGREGATES = Map.of(
        "bit_and", "BIT_AND",
        "bit_or", "BIT_OR",
        "bit_xor", "BIT_XOR"
    );
    private static final Set<String> DISTINCT_INSENSITIVE = Set.of("min", "max");

    static {
        AGGREGATES.put("min", "MIN");
        AGGREGATES.put("max", "MAX");
        AGGREGATES.put("sum", "SUM");
        AGGREGATES.put("avg", "AVG");
        AGGREGATES.put("mean", "AVG");
        AGGREGATES.put("stddev", "STDDEV_SAMP");
        AGGREGATES.put("stddev_samp", "STDDEV_SAMP");
        AGGREGATES.put("stddev_pop", "STDDEV_POP");
        AGGREGATES.put("variance", "VAR_SAMP");
        AGGREGATES.put("var_samp", "VAR_SAMP");
        AGGREGATES.put("var_pop", "VAR_POP");
        AGGREGATES.put("approx_count_distinct", "APPROX_COUNT_DISTINCT");
    }

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (!(expression instanceof AggregateExpression aggregate)) {
            return Optional.empty();
        }

        // An untranslatable filter makes the whole aggregate untranslatable
        Optional<Fragment> filter = Optional.empty();
        if (aggregate.filter().isPresent()) {
            filter = translator.translate(aggregate.filter().get());
            if (filter.isEmpty()) {
                return Optional.empty();
            }
        }

        String name = aggregate.normalizedName();
        if (name.equals("count")) {
            return count(aggregate, filter, translator);
        }

        String function = AGGREGATES.get(name);
        if (function == null) {
            function = bitAggregate(name, translator.context());
        }
        if (function == null || !hasSupportedArity(name, aggregate.arguments())) {
            return Optional.empty();
        }
        if (aggregate.isDistinct() && !DISTINCT_INSENSITIVE.contains(name)) {
            return Optional.empty();
        }

        // approx_count_distinct ignores its relative standard deviation argument
        String remote = function;
        Optional<Fragment> finalFilter = filter;
        return translator.translate(aggregate.arguments().get(0))
            .map(argument -> withFilter(remote, argument, finalFilter));
    }

    private static Optional<Fragment> count(AggregateExpression aggregate, Optional<Fragment> filter,
                                            ExpressionTranslator translator) {
        List<Expression> arguments = aggregate.arguments();
        if (aggregate.isDistinct()) {
            if (filter.isPresent() || arguments.isEmpty()) {
                return Optional.empty();
            }
            return translator.translateAll(arguments)
                .map(args -> Sql.func("COUNT", Sql.keywords("DISTINCT", args)));
        }
        if (arguments.isEmpty()) {
            return Optional.of(withFilter("COUNT", Sql.number(1), filter));
        }
        if (arguments.size() > 1) {
            return Optional.empty();
        }
        return translator.translate(arguments.get(0))
            .map(argument -> withFilter("COUNT", argument, filter));
    }

    private static String bitAggregate(String name, TranslationContext context) {
        String function = BIT_AGGREGATES.get(name);
        if (function != null && context.supports(DialectLimits.BIT_AGGREGATES_SINCE)) {
            return function;
        }
        return null;
    }

    private static boolean hasSupportedArity(String name, List<Expression> arguments) {
        if (name.equals("approx_count_distinct")) {
            return arguments.size() == 1 || arguments.size() == 2;
        }
        return arguments.size() == 1;
    }

    /**
     * {@code F(x)}, or {@code F(IF(filter, x, NULL))} when filtered.
     */
    static Fragment withFilter(String function, Fragment argument, Optional<Fragment> filter) {
        if (filter.isEmpty()) {
            return Sql.func(function, argument);
        }
        return Sql.func(function, Sql.func("IF", filter.get(), argument, Sql.nullValue()));
    }
}
