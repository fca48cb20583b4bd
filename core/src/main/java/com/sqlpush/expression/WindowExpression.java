package com.sqlpush.expression;

import com.sqlpush.expression.window.SortOrder;
import com.sqlpush.expression.window.WindowFrame;
import com.sqlpush.types.DataType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Function evaluated over a window of rows: an {@link AggregateExpression}, or
 * a ranking {@link FunctionCall} such as {@code row_number} or {@code ntile}.
 *
 * <p>Partition and order lists may be empty. Without a frame the remote
 * default frame applies.
 */
public final class WindowExpression implements Expression {

    private final Expression function;
    private final List<Expression> partitionBy;
    private final List<SortOrder> orderBy;
    private final WindowFrame frame;

    /**
     * @param frame the explicit frame, or null for the default frame
     */
    public WindowExpression(Expression function, List<Expression> partitionBy,
                            List<SortOrder> orderBy, WindowFrame frame) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.partitionBy = List.copyOf(partitionBy);
        this.orderBy = List.copyOf(orderBy);
        this.frame = frame;
    }

    public WindowExpression(Expression function, List<Expression> partitionBy, List<SortOrder> orderBy) {
        this(function, partitionBy, orderBy, null);
    }

    public Expression function() {
        return function;
    }

    public List<Expression> partitionBy() {
        return partitionBy;
    }

    public List<SortOrder> orderBy() {
        return orderBy;
    }

    public Optional<WindowFrame> frame() {
        return Optional.ofNullable(frame);
    }

    @Override
    public DataType dataType() {
        return function.dataType();
    }

    @Override
    public boolean nullable() {
        return function.nullable();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof WindowExpression other
            && function.equals(other.function)
            && partitionBy.equals(other.partitionBy)
            && orderBy.equals(other.orderBy)
            && Objects.equals(frame, other.frame);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, partitionBy, orderBy, frame);
    }

    @Override
    public String toString() {
        return function + " over(partition " + partitionBy + " order " + orderBy
            + (frame == null ? "" : " " + frame) + ")";
    }
}
