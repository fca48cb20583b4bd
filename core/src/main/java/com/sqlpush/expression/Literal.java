package com.sqlpush.expression;

import com.sqlpush.types.BooleanType;
import com.sqlpush.types.DataType;
import com.sqlpush.types.DateType;
import com.sqlpush.types.DecimalType;
import com.sqlpush.types.DoubleType;
import com.sqlpush.types.IntegerType;
import com.sqlpush.types.LongType;
import com.sqlpush.types.NullType;
import com.sqlpush.types.StringType;
import com.sqlpush.types.TimestampType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Constant value in its host representation.
 *
 * <p>Integral values are {@code Byte}, {@code Short}, {@code Integer} or
 * {@code Long}; decimals are {@code BigDecimal}; floating values may be NaN or
 * infinite. Dates are {@code LocalDate}, timestamps {@code Instant} or
 * {@code LocalDateTime}, intervals {@link com.sqlpush.types.CalendarInterval}.
 *
 * <p>Arguments that must be constant, such as format strings and weekday
 * names, only match when they are literals.
 *
 * @param value the value, or null for a NULL literal
 * @param dataType the value's type
 */
public record Literal(Object value, DataType dataType) implements Expression {

    public Literal {
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public String toString() {
        return value == null ? "null:" + dataType : value + ":" + dataType;
    }

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    /** Typed with the value's own precision and scale. */
    public static Literal of(BigDecimal value) {
        BigDecimal normalized = value.scale() < 0 ? value.setScale(0) : value;
        int scale = normalized.scale();
        int precision = Math.max(scale, normalized.precision());
        return new Literal(value, new DecimalType(precision, scale));
    }

    public static Literal of(LocalDate value) {
        return new Literal(value, DateType.get());
    }

    public static Literal of(Instant value) {
        return new Literal(value, TimestampType.get());
    }

    public static Literal nullValue(DataType dataType) {
        return new Literal(null, dataType);
    }

    /** Untyped NULL. */
    public static Literal nullValue() {
        return new Literal(null, NullType.get());
    }
}
