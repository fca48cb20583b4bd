package com.sqlpush.translator;

/**
 * Fixed properties of the remote dialect.
 */
public final class DialectLimits {

    /** Largest DECIMAL precision the remote database accepts. */
    public static final int MAX_DECIMAL_PRECISION = 65;

    /** Largest DECIMAL scale the remote database accepts. */
    public static final int MAX_DECIMAL_SCALE = 30;

    /** Host pattern equal to the remote FROM_UNIXTIME default output. */
    public static final String DEFAULT_TIME_FORMAT = "yyyy-MM-dd HH:mm:ss";

    /** Digits of an epoch timestamp expressed in milliseconds. */
    public static final int EPOCH_MILLIS_DIGITS = 13;

    /** Version assumed when none is configured. */
    public static final DialectVersion DEFAULT_VERSION = DialectVersion.parse("7.0.0");

    /** First version with BIT_AND / BIT_OR / BIT_XOR aggregates. */
    public static final DialectVersion BIT_AGGREGATES_SINCE = DialectVersion.parse("7.0.1");

    /** First version with UUID(). */
    public static final DialectVersion UUID_SINCE = DialectVersion.parse("7.5.0");

    private DialectLimits() {
    }
}
