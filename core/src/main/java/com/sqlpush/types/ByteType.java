package com.sqlpush.types;

/**
 * 8-bit signed integer.
 */
public final class ByteType extends AtomicType {

    private static final ByteType INSTANCE = new ByteType();

    private ByteType() {
        super("tinyint");
    }

    public static ByteType get() {
        return INSTANCE;
    }
}
