package com.sqlpush.expression;

import com.sqlpush.types.DataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate function call with optional DISTINCT modifier and FILTER clause.
 *
 * <p>Examples:
 * <pre>
 *   COUNT(*)                               -- no arguments
 *   SUM(amount)
 *   COUNT(DISTINCT customer_id)
 *   MAX(price) FILTER (WHERE region = 'EU')
 * </pre>
 */
public final class AggregateExpression implements Expression {

    private final String function;
    private final List<Expression> arguments;
    private final boolean distinct;
    private final Expression filter;
    private final DataType dataType;

    /**
     * Creates an aggregate expression.
     *
     * @param function the aggregate function name (COUNT, SUM, MAX, BIT_AND, ...)
     * @param arguments the aggregated expressions (empty for COUNT(*))
     * @param distinct whether to aggregate only distinct values
     * @param filter the FILTER condition (may be null)
     * @param dataType the resolved result type
     */
    public AggregateExpression(String function, List<Expression> arguments, boolean distinct,
                               Expression filter, DataType dataType) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.distinct = distinct;
        this.filter = filter;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a single-argument aggregate without DISTINCT or FILTER.
     */
    public static AggregateExpression of(String function, Expression argument, DataType dataType) {
        return new AggregateExpression(function, List.of(argument), false, null, dataType);
    }

    public String function() {
        return function;
    }

    public String normalizedName() {
        return function.toLowerCase(Locale.ROOT);
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public boolean isDistinct() {
        return distinct;
    }

    public Optional<Expression> filter() {
        return Optional.ofNullable(filter);
    }

    /**
     * Returns a copy of this aggregate with the given FILTER condition.
     *
     * @param condition the filter condition
     * @return the filtered aggregate
     */
    public AggregateExpression withFilter(Expression condition) {
        return new AggregateExpression(function, arguments, distinct, condition, dataType);
    }

    /**
     * Returns a copy of this aggregate with DISTINCT applied.
     *
     * @return the distinct aggregate
     */
    public AggregateExpression asDistinct() {
        return new AggregateExpression(function, arguments, true, filter, dataType);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return !"count".equals(normalizedName());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(function).append('(');
        if (distinct) {
            sb.append("DISTINCT ");
        }
        sb.append(arguments.isEmpty() ? "*" : arguments.toString());
        sb.append(')');
        if (filter != null) {
            sb.append(" FILTER (WHERE ").append(filter).append(')');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateExpression)) return false;
        AggregateExpression that = (AggregateExpression) obj;
        return distinct == that.distinct &&
               function.equals(that.function) &&
               arguments.equals(that.arguments) &&
               Objects.equals(filter, that.filter) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments, distinct, filter, dataType);
    }
}
