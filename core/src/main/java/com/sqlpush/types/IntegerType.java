package com.sqlpush.types;

/**
 * 32-bit signed integer.
 */
public final class IntegerType extends AtomicType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {
        super("int");
    }

    public static IntegerType get() {
        return INSTANCE;
    }
}
