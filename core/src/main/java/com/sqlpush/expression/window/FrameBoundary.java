package com.sqlpush.expression.window;

import com.sqlpush.expression.Expression;
import com.sqlpush.expression.Literal;

import java.util.Objects;

/**
 * One end of a window frame.
 *
 * <p>Offsets are signed, as the host engine represents them: a negative offset
 * lies before the current row, a non-negative one at or after it. The offset is
 * an expression so that hosts which keep frame offsets symbolic can pass them
 * through unchanged.
 *
 * <ul>
 *   <li>{@link UnboundedPreceding}: start of partition</li>
 *   <li>{@link UnboundedFollowing}: end of partition</li>
 *   <li>{@link CurrentRow}: the current row</li>
 *   <li>{@link Offset}: N rows/values before or after the current row</li>
 * </ul>
 */
public sealed interface FrameBoundary {

    record UnboundedPreceding() implements FrameBoundary {}

    record UnboundedFollowing() implements FrameBoundary {}

    record CurrentRow() implements FrameBoundary {}

    record Offset(Expression offset) implements FrameBoundary {
        public Offset {
            Objects.requireNonNull(offset, "offset must not be null");
        }
    }

    static FrameBoundary unboundedPreceding() {
        return new UnboundedPreceding();
    }

    static FrameBoundary unboundedFollowing() {
        return new UnboundedFollowing();
    }

    static FrameBoundary currentRow() {
        return new CurrentRow();
    }

    /**
     * Creates a signed integer offset boundary.
     *
     * @param offset negative for rows before the current row
     * @return the boundary
     */
    static FrameBoundary offset(int offset) {
        return new Offset(Literal.of(offset));
    }

    static FrameBoundary offset(Expression offset) {
        return new Offset(offset);
    }
}
