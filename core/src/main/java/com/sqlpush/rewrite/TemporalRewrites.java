package com.sqlpush.rewrite;

import com.sqlpush.expression.BinaryExpression;
import com.sqlpush.expression.CastExpression;
import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.expression.Literal;
import com.sqlpush.expression.UnaryExpression;
import com.sqlpush.translator.DialectLimits;
import com.sqlpush.types.BooleanType;
import com.sqlpush.types.DataType;
import com.sqlpush.types.DateType;
import com.sqlpush.types.DoubleType;
import com.sqlpush.types.IntegerType;
import com.sqlpush.types.LongType;
import com.sqlpush.types.StringType;
import com.sqlpush.types.TimestampType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Desugars the composite epoch-millisecond temporal functions into trees of
 * primitive functions that the translator already knows how to render.
 *
 * <p>Supported functions:
 * <ul>
 *   <li>{@code day_start(ts, tz, plusDays)}</li>
 *   <li>{@code string_to_date(str, format, tz)}</li>
 *   <li>{@code date_to_string(ts, format, tz)}</li>
 *   <li>{@code day_diff(endTs, startTs, tz)}</li>
 *   <li>{@code week_diff(endTs, startTs, startDay, tz)}</li>
 *   <li>{@code day_of_the_week(ts, tz)}</li>
 *   <li>{@code from_unix_time_tz(sec, format, tz)}</li>
 *   <li>{@code string_compare_ci(l, r)}, {@code string_compare_neq_ci(l, r)}</li>
 * </ul>
 *
 * <p>A rewrite whose constant arguments are not literals returns empty.
 * An unknown weekday name in {@code week_diff} throws.
 */
public final class TemporalRewrites {

    private static final String[] WEEKDAY_NAMES =
        {"monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday"};

    private TemporalRewrites() {
    }

    /**
     * Rewrites a composite temporal function call.
     *
     * @param call the function call
     * @return the rewritten tree, or empty if the call is not a composite
     *         temporal function or lacks a required literal argument
     * @throws com.sqlpush.exception.TranslationException on an unknown weekday name
     */
    public static Optional<Expression> rewrite(FunctionCall call) {
        if (call.is("day_start", 3)) {
            return Optional.of(dayStart(call.argument(0), call.argument(1), call.argument(2)));
        }
        if (call.is("string_to_date", 3)) {
            return Optional.of(stringToDate(call.argument(0), call.argument(1), call.argument(2)));
        }
        if (call.is("date_to_string", 3)) {
            return fromUnixTimeTz(call.argument(0), call.argument(1), call.argument(2));
        }
        if (call.is("day_diff", 3)) {
            return Optional.of(dayDiff(call.argument(0), call.argument(1), call.argument(2)));
        }
        if (call.is("week_diff", 4)) {
            return weekDiff(call.argument(0), call.argument(1), call.argument(2), call.argument(3));
        }
        if (call.is("day_of_the_week", 2)) {
            return Optional.of(dayOfTheWeek(call.argument(0), call.argument(1)));
        }
        if (call.is("from_unix_time_tz", 3)) {
            return fromUnixTimeTz(call.argument(0), call.argument(1), call.argument(2));
        }
        if (call.is("string_compare_ci", 2)) {
            return Optional.of(stringCompareCi(call.argument(0), call.argument(1)));
        }
        if (call.is("string_compare_neq_ci", 2)) {
            return Optional.of(UnaryExpression.not(
                fn("string_compare_ci", BooleanType.get(), call.argument(0), call.argument(1))));
        }
        return Optional.empty();
    }

    // unix_millis(convert_timezone(tz, 'UTC', date_trunc('DAY', date_add(local(ts), plusDays))))
    private static Expression dayStart(Expression ts, Expression tz, Expression plusDays) {
        Expression local = fn("from_unix_time_tz", StringType.get(), ts, defaultFormat(), tz);
        Expression shifted = fn("date_add", DateType.get(), local, plusDays);
        Expression truncated = fn("date_trunc", TimestampType.get(), Literal.of("DAY"), shifted);
        return fn("unix_millis", LongType.get(),
            fn("convert_timezone", TimestampType.get(), tz, Literal.of("UTC"), truncated));
    }

    private static Expression stringToDate(Expression str, Expression format, Expression tz) {
        Expression parsed = fn("to_timestamp", TimestampType.get(), str, format);
        return fn("unix_millis", LongType.get(),
            fn("convert_timezone", TimestampType.get(), tz, Literal.of("UTC"), parsed));
    }

    private static Expression dayDiff(Expression endTs, Expression startTs, Expression tz) {
        return fn("datediff", IntegerType.get(),
            fn("from_unix_time_tz", StringType.get(), endTs, defaultFormat(), tz),
            fn("from_unix_time_tz", StringType.get(), startTs, defaultFormat(), tz));
    }

    private static Optional<Expression> weekDiff(Expression endTs, Expression startTs,
                                                 Expression startDay, Expression tz) {
        if (!(startDay instanceof Literal) || ((Literal) startDay).isNull()) {
            return Optional.empty();
        }
        int offset = WeekdayOffsets.offsetOf(((Literal) startDay).value().toString());
        return Optional.of(BinaryExpression.subtract(
            weeksSinceEpoch(endTs, tz, offset),
            weeksSinceEpoch(startTs, tz, offset)));
    }

    // floor((day_diff(date_from_unix_date(-1), ts, tz) + offset) / 7)
    private static Expression weeksSinceEpoch(Expression ts, Expression tz, int offset) {
        Expression epochEve = fn("date_from_unix_date", DateType.get(), Literal.of(-1));
        Expression days = fn("day_diff", IntegerType.get(), epochEve, ts, tz);
        Expression shifted = BinaryExpression.add(days, Literal.of(offset));
        Expression weeks = new BinaryExpression(shifted, BinaryExpression.Operator.DIVIDE,
                                                Literal.of(7), DoubleType.get());
        return fn("floor", LongType.get(), weeks);
    }

    private static Expression dayOfTheWeek(Expression ts, Expression tz) {
        List<Expression> args = new ArrayList<>();
        args.add(fn("weekday", IntegerType.get(),
            fn("from_unix_time_tz", StringType.get(), ts, defaultFormat(), tz)));
        for (int i = 0; i < WEEKDAY_NAMES.length; i++) {
            args.add(Literal.of(i));
            args.add(Literal.of(WEEKDAY_NAMES[i]));
        }
        args.add(Literal.nullValue());
        return new FunctionCall("decode", args, StringType.get());
    }

    // date_format(convert_timezone(current_timezone(), tz, from_unixtime(seconds(sec), default)), format)
    private static Optional<Expression> fromUnixTimeTz(Expression sec, Expression format, Expression tz) {
        if (!(format instanceof Literal)) {
            return Optional.empty();
        }
        Expression isMillis = BinaryExpression.equal(
            fn("length", IntegerType.get(), new CastExpression(sec, StringType.get())),
            Literal.of(DialectLimits.EPOCH_MILLIS_DIGITS));
        Expression millisToSeconds = fn("floor", LongType.get(),
            new BinaryExpression(sec, BinaryExpression.Operator.DIVIDE, Literal.of(1000), DoubleType.get()));
        Expression seconds = fn("if", LongType.get(), isMillis, millisToSeconds, sec);
        Expression local = fn("convert_timezone", TimestampType.get(),
            fn("current_timezone", StringType.get()), tz,
            fn("from_unixtime", StringType.get(), seconds, defaultFormat()));
        return Optional.of(fn("date_format", StringType.get(), local, format));
    }

    private static Expression stringCompareCi(Expression left, Expression right) {
        return BinaryExpression.equal(
            fn("lower", StringType.get(), left),
            fn("lower", StringType.get(), right));
    }

    private static Literal defaultFormat() {
        return Literal.of(DialectLimits.DEFAULT_TIME_FORMAT);
    }

    private static FunctionCall fn(String name, DataType type, Expression... args) {
        return FunctionCall.of(name, type, args);
    }
}
