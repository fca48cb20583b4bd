package com.sqlpush.format;

/**
 * Target notation of a transpiled date pattern.
 */
public enum FormatMode {
    /** Percent symbols as used by DATE_FORMAT / FROM_UNIXTIME, e.g. {@code %Y-%m-%d}. */
    SYMBOLS,
    /** Specifiers as used by TO_CHAR / TO_TIMESTAMP / TO_DATE, e.g. {@code YYYY-MM-DD}. */
    SPECIFIERS
}
