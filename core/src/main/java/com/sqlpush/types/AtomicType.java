package com.sqlpush.types;

/**
 * Base of the types without parameters.
 *
 * <p>Each subclass has exactly one instance, obtained through its static
 * {@code get()}, so two atomic types are equal when they have the same class.
 */
public abstract sealed class AtomicType implements DataType
    permits BooleanType, ByteType, ShortType, IntegerType, LongType,
            FloatType, DoubleType, StringType, BinaryType,
            DateType, TimestampType, NullType, CalendarIntervalType {

    private final String typeName;

    AtomicType(String typeName) {
        this.typeName = typeName;
    }

    @Override
    public final String typeName() {
        return typeName;
    }

    @Override
    public final boolean equals(Object obj) {
        return obj != null && obj.getClass() == getClass();
    }

    @Override
    public final int hashCode() {
        return typeName.hashCode();
    }

    @Override
    public final String toString() {
        return typeName;
    }
}
