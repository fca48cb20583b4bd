package com.sqlpush.translator.rules;

import com.sqlpush.expression.AggregateExpression;
import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.expression.Literal;
import com.sqlpush.expression.WindowExpression;
import com.sqlpush.expression.window.FrameBoundary;
import com.sqlpush.expression.window.SortOrder;
import com.sqlpush.expression.window.WindowFrame;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.translator.ExpressionTranslator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Window functions: {@code fn OVER (PARTITION BY .. ORDER BY .. frame)}.
 *
 * <p>The window function is an aggregate or one of the ranking functions
 * row_number, rank, dense_rank, percent_rank and ntile.
 *
 * <p>The remote database sorts NULLs first when ascending and last when
 * descending, with no way to override it, so only those two orderings are
 * translatable.
 *
 * <p>Frame offsets are signed: an integer literal {@code n} renders as
 * {@code |n| PRECEDING} when negative and {@code n FOLLOWING} otherwise.
 * Literals outside the int range are untranslatable.
 * Any other offset expression renders as {@code expr FOLLOWING}.
 */
public final class WindowRule implements TranslationRule {

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (!(expression instanceof WindowExpression window)) {
            return Optional.empty();
        }
        Optional<Fragment> function = windowFunction(window.function(), translator);
        if (function.isEmpty()) {
            return Optional.empty();
        }

        List<Fragment> specification = new ArrayList<>();
        if (!window.partitionBy().isEmpty()) {
            Optional<Fragment> partitions = translator.translateAll(window.partitionBy());
            if (partitions.isEmpty()) {
                return Optional.empty();
            }
            specification.add(Sql.keywords("PARTITION BY", partitions.get()));
        }
        if (!window.orderBy().isEmpty()) {
            List<Fragment> orders = new ArrayList<>();
            for (SortOrder order : window.orderBy()) {
                Optional<Fragment> sortOrder = sortOrder(order, translator);
                if (sortOrder.isEmpty()) {
                    return Optional.empty();
                }
                orders.add(sortOrder.get());
            }
            specification.add(Sql.keywords("ORDER BY", Fragment.join(orders, ", ")));
        }
        if (window.frame().isPresent()) {
            Optional<Fragment> frame = frame(window.frame().get(), translator);
            if (frame.isEmpty()) {
                return Optional.empty();
            }
            specification.add(frame.get());
        }

        return Optional.of(Sql.keywords(function.get(), "OVER",
            Fragment.parenthesize(Fragment.join(specification, " "))));
    }

    private static Optional<Fragment> windowFunction(Expression function, ExpressionTranslator translator) {
        if (function instanceof AggregateExpression) {
            return translator.translate(function);
        }
        if (!(function instanceof FunctionCall call)) {
            return Optional.empty();
        }
        switch (call.normalizedName()) {
            case "row_number":
                return call.argumentCount() == 0 ? Optional.of(Fragment.raw("ROW_NUMBER()")) : Optional.empty();
            // the host passes the ordering of rank functions as arguments; it is already in the window
            case "rank":
                return Optional.of(Fragment.raw("RANK()"));
            case "dense_rank":
                return Optional.of(Fragment.raw("DENSE_RANK()"));
            case "percent_rank":
                return Optional.of(Fragment.raw("PERCENT_RANK()"));
            case "ntile":
                if (call.argumentCount() != 1) {
                    return Optional.empty();
                }
                return translator.translate(call.argument(0)).map(buckets -> Sql.func("NTILE", buckets));
            default:
                return Optional.empty();
        }
    }

    private static Optional<Fragment> sortOrder(SortOrder order, ExpressionTranslator translator) {
        String direction;
        if (order.direction() == SortOrder.Direction.ASCENDING
                && order.nullOrdering() == SortOrder.NullOrdering.NULLS_FIRST) {
            direction = "ASC";
        } else if (order.direction() == SortOrder.Direction.DESCENDING
                && order.nullOrdering() == SortOrder.NullOrdering.NULLS_LAST) {
            direction = "DESC";
        } else {
            return Optional.empty();
        }
        return translator.translate(order.child())
            .map(child -> Sql.keywords(Fragment.parenthesize(child), direction));
    }

    private static Optional<Fragment> frame(WindowFrame frame, ExpressionTranslator translator) {
        Optional<Fragment> lower = boundary(frame.lower(), translator);
        Optional<Fragment> upper = boundary(frame.upper(), translator);
        if (lower.isEmpty() || upper.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Sql.keywords(frame.frameType().sql(), "BETWEEN", lower.get(), "AND", upper.get()));
    }

    private static Optional<Fragment> boundary(FrameBoundary boundary, ExpressionTranslator translator) {
        if (boundary instanceof FrameBoundary.UnboundedPreceding) {
            return Optional.of(Fragment.raw("UNBOUNDED PRECEDING"));
        }
        if (boundary instanceof FrameBoundary.UnboundedFollowing) {
            return Optional.of(Fragment.raw("UNBOUNDED FOLLOWING"));
        }
        if (boundary instanceof FrameBoundary.CurrentRow) {
            return Optional.of(Fragment.raw("CURRENT ROW"));
        }
        Expression offset = ((FrameBoundary.Offset) boundary).offset();
        if (offset instanceof Literal literal
                && (literal.value() instanceof Integer || literal.value() instanceof Long)) {
            long n = ((Number) literal.value()).longValue();
            // frame offsets are int-sized on the remote side
            if (n < Integer.MIN_VALUE || n > Integer.MAX_VALUE) {
                return Optional.empty();
            }
            if (n < 0) {
                return Optional.of(Fragment.raw(-n + " PRECEDING"));
            }
            return Optional.of(Fragment.raw(n + " FOLLOWING"));
        }
        return translator.translate(offset).map(value -> Sql.keywords(value, "FOLLOWING"));
    }
}
