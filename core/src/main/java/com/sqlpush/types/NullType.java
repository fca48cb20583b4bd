package com.sqlpush.types;

/**
 * Type of the untyped NULL literal.
 */
public final class NullType extends AtomicType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {
        super("void");
    }

    public static NullType get() {
        return INSTANCE;
    }
}
