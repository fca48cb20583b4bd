package com.sqlpush.types;

/**
 * Fixed-point decimal with {@code precision} total digits, {@code scale} of
 * them after the point.
 *
 * <p>The host allows wider decimals than the remote dialect. The type keeps
 * the host's precision; narrowing happens only when it is rendered, through
 * {@link #clampTo(int, int)}.
 *
 * @param precision total number of digits, at least 1
 * @param scale digits after the point, between 0 and {@code precision}
 */
public record DecimalType(int precision, int scale) implements DataType {

    public DecimalType {
        if (precision < 1) {
            throw new IllegalArgumentException("precision must be at least 1, got: " + precision);
        }
        if (scale < 0 || scale > precision) {
            throw new IllegalArgumentException("scale must be between 0 and " + precision + ", got: " + scale);
        }
    }

    /**
     * Returns this type narrowed to the given maximum precision and scale.
     *
     * <p>Each component is clamped on its own; a type already within the
     * limits is returned as is.
     *
     * @param maxPrecision the largest precision allowed
     * @param maxScale the largest scale allowed
     * @return the clamped decimal type
     */
    public DecimalType clampTo(int maxPrecision, int maxScale) {
        if (precision <= maxPrecision && scale <= maxScale) {
            return this;
        }
        int p = Math.min(maxPrecision, precision);
        return new DecimalType(p, Math.min(Math.min(maxScale, scale), p));
    }

    @Override
    public String typeName() {
        return "decimal(" + precision + "," + scale + ")";
    }

    @Override
    public String toString() {
        return typeName();
    }
}
