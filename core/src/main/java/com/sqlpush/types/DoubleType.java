package com.sqlpush.types;

/**
 * Double-precision floating point.
 */
public final class DoubleType extends AtomicType {

    private static final DoubleType INSTANCE = new DoubleType();

    private DoubleType() {
        super("double");
    }

    public static DoubleType get() {
        return INSTANCE;
    }
}
