package com.sqlpush.types;

/**
 * Calendar date without time of day.
 */
public final class DateType extends AtomicType {

    private static final DateType INSTANCE = new DateType();

    private DateType() {
        super("date");
    }

    public static DateType get() {
        return INSTANCE;
    }
}
