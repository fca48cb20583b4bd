package com.sqlpush.types;

/**
 * Semantic type of an expression node, as resolved by the host engine.
 *
 * <p>The translator trusts these types when it picks a literal encoding, a
 * CAST target or a decimal precision; it never infers types itself.
 */
public sealed interface DataType permits AtomicType, DecimalType {

    /**
     * Returns the host's name for this type, e.g. {@code bigint} or {@code decimal(10,2)}.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether this is one of the fixed-width integral types.
     *
     * @return true for tinyint, smallint, int and bigint
     */
    default boolean isIntegral() {
        return this instanceof ByteType || this instanceof ShortType
            || this instanceof IntegerType || this instanceof LongType;
    }
}
