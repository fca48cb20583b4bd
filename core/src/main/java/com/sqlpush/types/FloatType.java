package com.sqlpush.types;

/**
 * Single-precision floating point.
 */
public final class FloatType extends AtomicType {

    private static final FloatType INSTANCE = new FloatType();

    private FloatType() {
        super("float");
    }

    public static FloatType get() {
        return INSTANCE;
    }
}
