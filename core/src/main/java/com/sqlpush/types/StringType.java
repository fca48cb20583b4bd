package com.sqlpush.types;

/**
 * Variable-length character string.
 */
public final class StringType extends AtomicType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {
        super("string");
    }

    public static StringType get() {
        return INSTANCE;
    }
}
