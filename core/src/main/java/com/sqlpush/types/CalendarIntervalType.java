package com.sqlpush.types;

/**
 * Type of {@link CalendarInterval} values. Intervals never encode as literals;
 * only date arithmetic such as {@code time_add} accepts them.
 */
public final class CalendarIntervalType extends AtomicType {

    private static final CalendarIntervalType INSTANCE = new CalendarIntervalType();

    private CalendarIntervalType() {
        super("interval");
    }

    public static CalendarIntervalType get() {
        return INSTANCE;
    }
}
