package com.sqlpush.types;

import java.util.Objects;

/**
 * Value of a {@link CalendarIntervalType} literal.
 *
 * <p>An interval is kept as three independent components because months and
 * days have no fixed length in microseconds. Any component may be negative.
 */
public final class CalendarInterval {

    private final int months;
    private final int days;
    private final long microseconds;

    public CalendarInterval(int months, int days, long microseconds) {
        this.months = months;
        this.days = days;
        this.microseconds = microseconds;
    }

    public static CalendarInterval ofMonths(int months) {
        return new CalendarInterval(months, 0, 0L);
    }

    public static CalendarInterval ofDays(int days) {
        return new CalendarInterval(0, days, 0L);
    }

    public static CalendarInterval ofMicroseconds(long microseconds) {
        return new CalendarInterval(0, 0, microseconds);
    }

    public int months() {
        return months;
    }

    public int days() {
        return days;
    }

    public long microseconds() {
        return microseconds;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CalendarInterval)) return false;
        CalendarInterval that = (CalendarInterval) obj;
        return months == that.months && days == that.days && microseconds == that.microseconds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(months, days, microseconds);
    }

    @Override
    public String toString() {
        return "interval " + months + " months " + days + " days " + microseconds + " microseconds";
    }
}
