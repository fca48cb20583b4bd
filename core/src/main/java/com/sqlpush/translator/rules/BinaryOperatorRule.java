package com.sqlpush.translator.rules;

import com.sqlpush.expression.BinaryExpression;
import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.expression.Literal;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.functions.FunctionRegistry;
import com.sqlpush.functions.FunctionTranslator;
import com.sqlpush.rewrite.WeekdayOffsets;
import com.sqlpush.translator.DialectLimits;
import com.sqlpush.translator.ExpressionTranslator;
import com.sqlpush.types.CalendarInterval;
import com.sqlpush.types.IntegerType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Binary operators as {@code (left OP right)} and two-argument functions.
 *
 * <p>Two-argument functions whose rendering depends on a constant argument
 * (date patterns, truncation units, intervals, day names, hash widths, JSON
 * paths) are handled here; the rest come from the {@link FunctionRegistry}.
 */
public final class BinaryOperatorRule implements TranslationRule {

    private static final Map<String, String> TIMESTAMP_TRUNC_UNITS = new LinkedHashMap<>();
    private static final Map<String, String> DATE_TRUNC_UNITS = new LinkedHashMap<>();

    // EXTRACT fields accepted by the remote dialect
    private static final Set<String> EXTRACT_FIELDS = Set.of(
        "YEAR", "QUARTER", "MONTH", "WEEK", "DAY", "HOUR", "MINUTE", "SECOND", "MICROSECOND",
        "YEAR_MONTH", "DAY_HOUR", "DAY_MINUTE", "DAY_SECOND", "DAY_MICROSECOND",
        "HOUR_MINUTE", "HOUR_SECOND", "HOUR_MICROSECOND", "MINUTE_SECOND", "MINUTE_MICROSECOND",
        "SECOND_MICROSECOND"
    );

    static {
        // host truncation units the remote DATE_TRUNC does not know
        TIMESTAMP_TRUNC_UNITS.put("yyyy", "year");
        TIMESTAMP_TRUNC_UNITS.put("yy", "year");
        TIMESTAMP_TRUNC_UNITS.put("mon", "month");
        TIMESTAMP_TRUNC_UNITS.put("mm", "month");
        TIMESTAMP_TRUNC_UNITS.put("dd", "day");

        DATE_TRUNC_UNITS.put("yyyy", "year");
        DATE_TRUNC_UNITS.put("yy", "year");
        DATE_TRUNC_UNITS.put("mon", "month");
        DATE_TRUNC_UNITS.put("mm", "month");
    }

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (expression instanceof BinaryExpression binary) {
            Optional<Fragment> left = translator.translate(binary.left());
            if (left.isEmpty()) {
                return Optional.empty();
            }
            return translator.translate(binary.right())
                .map(right -> Sql.op(binary.operator().symbol(), left.get(), right));
        }
        if (expression instanceof FunctionCall call && call.argumentCount() == 2) {
            return function(call, translator);
        }
        return Optional.empty();
    }

    private static Optional<Fragment> function(FunctionCall call, ExpressionTranslator translator) {
        Expression first = call.argument(0);
        Expression second = call.argument(1);
        switch (call.normalizedName()) {
            case "date_format":
                return RuleSupport.stringLiteral(second).flatMap(pattern -> translator.translate(first)
                    .map(ts -> Sql.func("DATE_FORMAT", ts,
                        RuleSupport.string(translator.formats().toSymbols(pattern)))));
            case "from_unixtime":
                return RuleSupport.stringLiteral(second).flatMap(pattern -> translator.translate(first)
                    .map(seconds -> fromUnixTime(seconds, pattern, translator)));
            case "to_timestamp":
                return RuleSupport.stringLiteral(second).flatMap(pattern -> translator.translate(first)
                    .map(str -> Sql.func("TO_TIMESTAMP", str,
                        RuleSupport.string(translator.formats().toSpecifiers(pattern)))));
            case "to_date":
                return RuleSupport.stringLiteral(second).flatMap(pattern -> translator.translate(first)
                    .map(str -> Sql.func("DATE", Sql.func("TO_TIMESTAMP", str,
                        RuleSupport.string(translator.formats().toSpecifiers(pattern))))));
            case "date_trunc":
                return truncate(first, second, TIMESTAMP_TRUNC_UNITS, translator);
            case "trunc":
                return truncate(second, first, DATE_TRUNC_UNITS, translator);
            case "time_add":
                return timeAdd(first, second, translator);
            case "next_day":
                return nextDay(first, second, translator);
            case "extract":
                return extract(first, second, translator);
            case "sha2":
                return sha2(first, second, translator);
            case "find_in_set":
                return findInSet(first, second, translator);
            case "get_json_object":
                return getJsonObject(first, second, translator);
            case "format_number":
                return formatNumber(first, second, translator);
            default:
                return registered(call, translator);
        }
    }

    private static Optional<Fragment> registered(FunctionCall call, ExpressionTranslator translator) {
        Optional<FunctionTranslator> function = FunctionRegistry.lookup(call.functionName(), 2);
        if (function.isEmpty()) {
            return Optional.empty();
        }
        return RuleSupport.arguments(call, translator).map(args -> function.get().translate(args));
    }

    private static Fragment fromUnixTime(Fragment seconds, String pattern, ExpressionTranslator translator) {
        if (pattern.equals(DialectLimits.DEFAULT_TIME_FORMAT)) {
            return Sql.func("FROM_UNIXTIME", seconds);
        }
        return Sql.func("FROM_UNIXTIME", seconds, RuleSupport.string(translator.formats().toSymbols(pattern)));
    }

    /**
     * {@code DATE_TRUNC(unit, value)}. A literal unit is mapped to its remote
     * spelling; any other unit expression is mapped on the remote side.
     */
    private static Optional<Fragment> truncate(Expression unit, Expression value, Map<String, String> units,
                                               ExpressionTranslator translator) {
        Optional<Fragment> truncated = translator.translate(value);
        if (truncated.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> literalUnit = RuleSupport.stringLiteral(unit);
        if (literalUnit.isPresent()) {
            String mapped = units.getOrDefault(literalUnit.get().toLowerCase(Locale.ROOT), literalUnit.get());
            return Optional.of(Sql.func("DATE_TRUNC", RuleSupport.string(mapped), truncated.get()));
        }
        return translator.translate(unit).map(u -> {
            List<Fragment> parts = new ArrayList<>();
            parts.add(Fragment.raw("CASE"));
            parts.add(Sql.func("LOWER", u));
            for (Map.Entry<String, String> entry : units.entrySet()) {
                parts.add(Sql.keywords("WHEN", RuleSupport.string(entry.getKey()),
                                       "THEN", RuleSupport.string(entry.getValue())));
            }
            parts.add(Sql.keywords("ELSE", u, "END"));
            return Sql.func("DATE_TRUNC", Fragment.parenthesize(Fragment.join(parts, " ")), truncated.get());
        });
    }

    private static Optional<Fragment> timeAdd(Expression start, Expression interval,
                                              ExpressionTranslator translator) {
        if (!(interval instanceof Literal literal) || !(literal.value() instanceof CalendarInterval value)) {
            return Optional.empty();
        }
        return translator.translate(start).map(s -> {
            Fragment result = addInterval(s, value.months(), "MONTH");
            result = addInterval(result, value.days(), "DAY");
            return addInterval(result, value.microseconds(), "MICROSECOND");
        });
    }

    private static Fragment addInterval(Fragment start, long amount, String unit) {
        if (amount == 0) {
            return start;
        }
        return Sql.func("DATE_ADD", start, Sql.keywords("INTERVAL", Sql.number(amount), unit));
    }

    // ADDDATE(d, (((n - DAYOFWEEK(d)) + 6) % 7) + 1) with n = 1 for Sunday .. 7 for Saturday
    private static Optional<Fragment> nextDay(Expression startDate, Expression dayOfWeek,
                                              ExpressionTranslator translator) {
        Optional<String> day = RuleSupport.stringLiteral(dayOfWeek);
        if (day.isEmpty()) {
            return Optional.empty();
        }
        OptionalInt number = WeekdayOffsets.dayOfWeekNumber(day.get());
        if (number.isEmpty()) {
            return Optional.empty();
        }
        return translator.translate(startDate).map(d -> Sql.func("ADDDATE", d,
            Sql.op("+",
                Sql.op("%",
                    Sql.op("+",
                        Sql.op("-", Sql.number(number.getAsInt()), Sql.func("DAYOFWEEK", d)),
                        Sql.number(6)),
                    Sql.number(7)),
                Sql.number(1))));
    }

    private static Optional<Fragment> extract(Expression field, Expression source,
                                              ExpressionTranslator translator) {
        Optional<String> unit = RuleSupport.stringLiteral(field)
            .map(f -> f.trim().toUpperCase(Locale.ROOT))
            .filter(EXTRACT_FIELDS::contains);
        if (unit.isEmpty()) {
            return Optional.empty();
        }
        return translator.translate(source)
            .map(s -> Sql.func("EXTRACT", Sql.keywords(unit.get(), "FROM", s)));
    }

    // SHA-224 is not available remotely
    private static Optional<Fragment> sha2(Expression value, Expression bits, ExpressionTranslator translator) {
        Optional<Integer> width = RuleSupport.intLiteral(bits).filter(b -> b != 224);
        if (width.isEmpty()) {
            return Optional.empty();
        }
        return translator.translate(value).map(v -> Sql.func("SHA2", v, Sql.number(width.get())));
    }

    // (CASE value WHEN 'a' THEN 1 WHEN 'b' THEN 2 ... ELSE 0 END)
    private static Optional<Fragment> findInSet(Expression value, Expression set,
                                                ExpressionTranslator translator) {
        Optional<String> elements = RuleSupport.stringLiteral(set);
        if (elements.isEmpty()) {
            return Optional.empty();
        }
        return translator.translate(value).map(v -> {
            List<Fragment> parts = new ArrayList<>();
            parts.add(Fragment.raw("CASE"));
            parts.add(v);
            String[] items = elements.get().split(",");
            for (int i = 0; i < items.length; i++) {
                parts.add(Sql.keywords("WHEN", RuleSupport.string(items[i]), "THEN", Sql.number(i + 1)));
            }
            parts.add(Fragment.raw("ELSE 0 END"));
            return Fragment.parenthesize(Fragment.join(parts, " "));
        });
    }

    /**
     * Only dotted paths rooted at {@code $.} are supported. Intermediate keys
     * descend with JSON_EXTRACT_JSON; the last key returns a string when the
     * value is a JSON string and the JSON text otherwise.
     */
    private static Optional<Fragment> getJsonObject(Expression json, Expression path,
                                                    ExpressionTranslator translator) {
        Optional<String> jsonPath = RuleSupport.stringLiteral(path).filter(p -> p.startsWith("$."));
        if (jsonPath.isEmpty()) {
            return Optional.empty();
        }
        return translator.translate(json).map(document -> {
            String[] keys = jsonPath.get().substring(2).split("\\.", -1);
            Fragment query = document;
            for (int i = 0; i < keys.length - 1; i++) {
                query = Sql.func("JSON_EXTRACT_JSON", query, RuleSupport.string(keys[i]));
            }
            Fragment goal = RuleSupport.string(keys[keys.length - 1]);
            return Sql.func("IF",
                Sql.op("=",
                    Sql.func("JSON_GET_TYPE", Sql.func("JSON_EXTRACT_JSON", query, goal)),
                    RuleSupport.string("string")),
                Sql.func("JSON_EXTRACT_STRING", query, goal),
                Sql.func("JSON_EXTRACT_JSON", query, goal));
        });
    }

    private static Optional<Fragment> formatNumber(Expression value, Expression decimals,
                                                   ExpressionTranslator translator) {
        if (!(decimals.dataType() instanceof IntegerType)) {
            return Optional.empty();
        }
        Optional<Fragment> number = translator.translate(value);
        if (number.isEmpty()) {
            return Optional.empty();
        }
        return translator.translate(decimals).map(d ->
            FunctionRegistry.ifNegative(d, Sql.nullValue(), Sql.func("FORMAT", number.get(), d)));
    }
}
