package com.sqlpush.types;

/**
 * 64-bit signed integer.
 */
public final class LongType extends AtomicType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {
        super("bigint");
    }

    public static LongType get() {
        return INSTANCE;
    }
}
