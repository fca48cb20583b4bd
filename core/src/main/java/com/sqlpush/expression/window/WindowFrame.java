package com.sqlpush.expression.window;

import java.util.Objects;

/**
 * Frame specification of a window: {@code ROWS|RANGE BETWEEN lower AND upper}.
 *
 * <p>Frame Types:
 * <ul>
 *   <li>ROWS: physical offset-based frames</li>
 *   <li>RANGE: logical value-based frames</li>
 * </ul>
 */
public final class WindowFrame {

    public enum FrameType {
        ROWS("ROWS"),
        RANGE("RANGE");

        private final String sql;

        FrameType(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    private final FrameType frameType;
    private final FrameBoundary lower;
    private final FrameBoundary upper;

    public WindowFrame(FrameType frameType, FrameBoundary lower, FrameBoundary upper) {
        this.frameType = Objects.requireNonNull(frameType, "frameType must not be null");
        this.lower = Objects.requireNonNull(lower, "lower must not be null");
        this.upper = Objects.requireNonNull(upper, "upper must not be null");
    }

    public FrameType frameType() {
        return frameType;
    }

    public FrameBoundary lower() {
        return lower;
    }

    public FrameBoundary upper() {
        return upper;
    }

    // ==================== Factory Methods ====================

    /**
     * ROWS frame between two signed offsets, e.g. {@code rowsBetween(-2, 0)}
     * for the two preceding rows and the current row.
     */
    public static WindowFrame rowsBetween(int lower, int upper) {
        return new WindowFrame(FrameType.ROWS, FrameBoundary.offset(lower), FrameBoundary.offset(upper));
    }

    public static WindowFrame rangeBetween(int lower, int upper) {
        return new WindowFrame(FrameType.RANGE, FrameBoundary.offset(lower), FrameBoundary.offset(upper));
    }

    public static WindowFrame unboundedPrecedingToCurrentRow() {
        return new WindowFrame(FrameType.ROWS, FrameBoundary.unboundedPreceding(), FrameBoundary.currentRow());
    }

    public static WindowFrame currentRowToUnboundedFollowing() {
        return new WindowFrame(FrameType.ROWS, FrameBoundary.currentRow(), FrameBoundary.unboundedFollowing());
    }

    public static WindowFrame entirePartition() {
        return new WindowFrame(FrameType.ROWS, FrameBoundary.unboundedPreceding(), FrameBoundary.unboundedFollowing());
    }

    @Override
    public String toString() {
        return frameType + " BETWEEN " + lower + " AND " + upper;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WindowFrame)) return false;
        WindowFrame that = (WindowFrame) obj;
        return frameType == that.frameType && lower.equals(that.lower) && upper.equals(that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frameType, lower, upper);
    }
}
