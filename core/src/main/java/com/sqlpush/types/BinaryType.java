package com.sqlpush.types;

/**
 * Variable-length byte string.
 */
public final class BinaryType extends AtomicType {

    private static final BinaryType INSTANCE = new BinaryType();

    private BinaryType() {
        super("binary");
    }

    public static BinaryType get() {
        return INSTANCE;
    }
}
