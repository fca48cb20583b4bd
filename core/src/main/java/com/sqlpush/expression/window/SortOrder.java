package com.sqlpush.expression.window;

import com.sqlpush.expression.Expression;

import java.util.Objects;

/**
 * Ordering specification of a window's ORDER BY clause.
 */
public final class SortOrder {

    public enum Direction {
        ASCENDING,
        DESCENDING
    }

    public enum NullOrdering {
        NULLS_FIRST,
        NULLS_LAST
    }

    private final Expression child;
    private final Direction direction;
    private final NullOrdering nullOrdering;

    public SortOrder(Expression child, Direction direction, NullOrdering nullOrdering) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.nullOrdering = Objects.requireNonNull(nullOrdering, "nullOrdering must not be null");
    }

    /**
     * Creates a sort order with the host's default null ordering for the
     * direction: NULLS FIRST when ascending, NULLS LAST when descending.
     */
    public SortOrder(Expression child, Direction direction) {
        this(child, direction,
             direction == Direction.ASCENDING ? NullOrdering.NULLS_FIRST : NullOrdering.NULLS_LAST);
    }

    public static SortOrder asc(Expression child) {
        return new SortOrder(child, Direction.ASCENDING);
    }

    public static SortOrder desc(Expression child) {
        return new SortOrder(child, Direction.DESCENDING);
    }

    public Expression child() {
        return child;
    }

    public Direction direction() {
        return direction;
    }

    public NullOrdering nullOrdering() {
        return nullOrdering;
    }

    @Override
    public String toString() {
        return child + " " + direction + " " + nullOrdering;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortOrder)) return false;
        SortOrder that = (SortOrder) obj;
        return child.equals(that.child) &&
               direction == that.direction &&
               nullOrdering == that.nullOrdering;
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, direction, nullOrdering);
    }
}
