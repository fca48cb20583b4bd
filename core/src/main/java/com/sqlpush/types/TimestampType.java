package com.sqlpush.types;

/**
 * Instant with microsecond precision, rendered in the session time zone.
 */
public final class TimestampType extends AtomicType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {
        super("timestamp");
    }

    public static TimestampType get() {
        return INSTANCE;
    }
}
