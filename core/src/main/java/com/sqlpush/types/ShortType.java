package com.sqlpush.types;

/**
 * 16-bit signed integer.
 */
public final class ShortType extends AtomicType {

    private static final ShortType INSTANCE = new ShortType();

    private ShortType() {
        super("smallint");
    }

    public static ShortType get() {
        return INSTANCE;
    }
}
