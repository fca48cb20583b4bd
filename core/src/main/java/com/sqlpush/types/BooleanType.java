package com.sqlpush.types;

/**
 * Boolean truth value.
 */
public final class BooleanType extends AtomicType {

    private static final BooleanType INSTANCE = new BooleanType();

    private BooleanType() {
        super("boolean");
    }

    public static BooleanType get() {
        return INSTANCE;
    }
}
