package com.sqlpush.functions;

import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.types.StringType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of host functions whose remote rendering depends only on their
 * translated arguments.
 *
 * <p>Entries are keyed by lower-case name and arity, so {@code log(x)} and
 * {@code log(b, x)} are distinct entries. Most functions are direct
 * mappings to a remote function of the same arity; the rest have a custom
 * {@link FunctionTranslator}.
 *
 * <p>Function categories:
 * <ul>
 *   <li>String functions: upper, lower, length, lpad, replace, etc.</li>
 *   <li>Math functions: ceil, floor, sqrt, atan2, hyperbolic identities, etc.</li>
 *   <li>Date/time functions: year, month, datediff, add_months, convert_timezone, etc.</li>
 *   <li>Hash functions: md5, sha1, crc32</li>
 *   <li>Null functions: nullif, nvl, ifnull</li>
 * </ul>
 *
 * <p>Functions that need a constant argument, the column type of an argument,
 * or the dialect version are rendered by the translator rules themselves.
 */
public final class FunctionRegistry {

    private static final Map<String, String> DIRECT_MAPPINGS = new HashMap<>();
    private static final Map<String, FunctionTranslator> CUSTOM_TRANSLATORS = new HashMap<>();

    static {
        initializeStringFunctions();
        initializeMathFunctions();
        initializeDateFunctions();
        initializeHashFunctions();
        initializeNullFunctions();
    }

    private FunctionRegistry() {
    }

    /**
     * Looks up the renderer of a function.
     *
     * @param functionName the host function name (any case)
     * @param arity the number of arguments
     * @return the translator, or empty if the function is not registered with that arity
     */
    public static Optional<FunctionTranslator> lookup(String functionName, int arity) {
        if (functionName == null || functionName.isEmpty()) {
            return Optional.empty();
        }
        String key = key(functionName, arity);
        String direct = DIRECT_MAPPINGS.get(key);
        if (direct != null) {
            return Optional.of(args -> Sql.func(direct, args));
        }
        return Optional.ofNullable(CUSTOM_TRANSLATORS.get(key));
    }

    public static boolean isSupported(String functionName, int arity) {
        return lookup(functionName, arity).isPresent();
    }

    /**
     * Gets the remote function name for a direct mapping.
     *
     * @param functionName the host function name
     * @param arity the number of arguments
     * @return the remote name, or empty if not a direct mapping
     */
    public static Optional<String> getDialectFunction(String functionName, int arity) {
        if (functionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(DIRECT_MAPPINGS.get(key(functionName, arity)));
    }

    public static int registeredFunctionCount() {
        return DIRECT_MAPPINGS.size() + CUSTOM_TRANSLATORS.size();
    }

    private static String key(String functionName, int arity) {
        return functionName.toLowerCase(Locale.ROOT) + "/" + arity;
    }

    private static void direct(String name, int arity, String dialectName) {
        DIRECT_MAPPINGS.put(key(name, arity), dialectName);
    }

    private static void custom(String name, int arity, FunctionTranslator translator) {
        CUSTOM_TRANSLATORS.put(key(name, arity), translator);
    }

    // ==================== String Functions ====================

    private static void initializeStringFunctions() {
        direct("upper", 1, "UPPER");
        direct("ucase", 1, "UPPER");
        direct("lower", 1, "LOWER");
        direct("lcase", 1, "LOWER");
        direct("initcap", 1, "INITCAP");
        direct("ascii", 1, "ASCII");
        direct("length", 1, "CHAR_LENGTH");
        direct("char_length", 1, "CHAR_LENGTH");
        direct("character_length", 1, "CHAR_LENGTH");
        direct("octet_length", 1, "LENGTH");
        direct("instr", 2, "INSTR");

        direct("replace", 3, "REPLACE");
        direct("substring_index", 3, "SUBSTRING_INDEX");
        direct("locate", 3, "LOCATE");
        direct("substr", 3, "SUBSTR");
        direct("substring", 3, "SUBSTR");

        custom("bit_length", 1, args ->
            Sql.op("*", Sql.func("LENGTH", args.get(0)), Sql.number(8)));

        // space(n) = LPAD('', n, ' ')
        custom("space", 1, args ->
            Sql.func("LPAD", string(""), args.get(0), string(" ")));

        custom("chr", 1, args ->
            Sql.func("IF", Sql.func("ISNULL", args.get(0)), Sql.nullValue(), Sql.func("CHAR", args.get(0))));
        custom("char", 1, CUSTOM_TRANSLATORS.get(key("chr", 1)));

        custom("contains", 2, args ->
            Sql.op(">", Sql.func("INSTR", args.get(0), args.get(1)), Sql.number(0)));
        custom("startswith", 2, args ->
            Sql.op("LIKE", args.get(0), Sql.func("CONCAT", args.get(1), string("%"))));
        custom("endswith", 2, args ->
            Sql.op("LIKE", args.get(0), Sql.func("CONCAT", string("%"), args.get(1))));

        // repeat(s, n) = LPAD('', max(n, 0) * CHAR_LENGTH(s), s)
        custom("repeat", 2, args ->
            Sql.func("LPAD", string(""),
                Sql.op("*", ifNegative(args.get(1), Sql.number(0), args.get(1)),
                       Sql.func("CHAR_LENGTH", args.get(0))),
                args.get(0)));

        custom("lpad", 3, args ->
            Sql.func("LPAD", args.get(0), ifNegative(args.get(1), Sql.number(0), args.get(1)), args.get(2)));
        custom("rpad", 3, args ->
            Sql.func("RPAD", args.get(0), ifNegative(args.get(1), Sql.number(0), args.get(1)), args.get(2)));

        // overlay(input, replace, pos, len); a negative len means "length of replace"
        custom("overlay", 4, args -> {
            Fragment input = args.get(0);
            Fragment replace = args.get(1);
            Fragment pos = args.get(2);
            Fragment len = args.get(3);
            Fragment head = Sql.func("LEFT", input, Sql.op("-", pos, Sql.number(1)));
            return Sql.func("IF",
                Sql.op("<", len, Sql.number(0)),
                Sql.func("CONCAT", head, replace,
                    Sql.func("SUBSTR", input, Sql.op("+", Sql.func("LENGTH", replace), pos))),
                Sql.func("CONCAT", head, replace,
                    Sql.func("SUBSTR", input, Sql.op("+", pos, len))));
        });
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions() {
        direct("abs", 1, "ABS");
        direct("acos", 1, "ACOS");
        direct("asin", 1, "ASIN");
        direct("atan", 1, "ATAN");
        direct("ceil", 1, "CEIL");
        direct("ceiling", 1, "CEIL");
        direct("cos", 1, "COS");
        direct("cot", 1, "COT");
        direct("exp", 1, "EXP");
        direct("floor", 1, "FLOOR");
        direct("ln", 1, "LOG");
        direct("log", 1, "LOG");
        direct("log2", 1, "LOG2");
        direct("log10", 1, "LOG10");
        direct("sign", 1, "SIGN");
        direct("signum", 1, "SIGN");
        direct("sin", 1, "SIN");
        direct("sqrt", 1, "SQRT");
        direct("tan", 1, "TAN");
        direct("degrees", 1, "DEGREES");
        direct("radians", 1, "RADIANS");
        direct("bin", 1, "BIN");
        direct("hex", 1, "HEX");
        direct("bit_count", 1, "BIT_COUNT");

        direct("atan2", 2, "ATAN2");
        direct("pow", 2, "POWER");
        direct("power", 2, "POWER");
        direct("log", 2, "LOG");

        custom("expm1", 1, args -> Sql.op("-", Sql.func("EXP", args.get(0)), Sql.number(1)));
        custom("log1p", 1, args -> Sql.func("LOG", Sql.op("+", args.get(0), Sql.number(1))));
        custom("rint", 1, args -> Sql.func("ROUND", args.get(0), Sql.number(0)));

        // tanh(x) = (exp(x) - exp(-x)) / (exp(x) + exp(-x))
        custom("tanh", 1, args -> Sql.op("/",
            Sql.op("-", Sql.func("EXP", args.get(0)), expNegated(args.get(0))),
            Sql.op("+", Sql.func("EXP", args.get(0)), expNegated(args.get(0)))));
        // sinh(x) = (exp(x) - exp(-x)) / 2
        custom("sinh", 1, args -> Sql.op("/",
            Sql.op("-", Sql.func("EXP", args.get(0)), expNegated(args.get(0))), Sql.number(2)));
        // cosh(x) = (exp(x) + exp(-x)) / 2
        custom("cosh", 1, args -> Sql.op("/",
            Sql.op("+", Sql.func("EXP", args.get(0)), expNegated(args.get(0))), Sql.number(2)));
        // asinh(x) = ln(x + sqrt(x^2 + 1))
        custom("asinh", 1, args -> Sql.func("LN", Sql.op("+", args.get(0),
            Sql.func("SQRT", Sql.op("+", Sql.func("POW", args.get(0), Sql.number(2)), Sql.number(1))))));
        // acosh(x) = ln(x + sqrt(x^2 - 1))
        custom("acosh", 1, args -> Sql.func("LN", Sql.op("+", args.get(0),
            Sql.func("SQRT", Sql.op("-", Sql.func("POW", args.get(0), Sql.number(2)), Sql.number(1))))));
        // atanh(x) = ln((1 + x) / (1 - x)) / 2
        custom("atanh", 1, args -> Sql.op("/",
            Sql.func("LN", Sql.op("/",
                Sql.op("+", Sql.number(1), args.get(0)),
                Sql.op("-", Sql.number(1), args.get(0)))),
            Sql.number(2)));

        custom("hypot", 2, args -> Sql.func("SQRT", Sql.op("+",
            Sql.func("POW", args.get(0), Sql.number(2)),
            Sql.func("POW", args.get(1), Sql.number(2)))));
    }

    // ==================== Date/Time Functions ====================

    private static void initializeDateFunctions() {
        direct("hour", 1, "HOUR");
        direct("minute", 1, "MINUTE");
        direct("second", 1, "SECOND");
        direct("dayofyear", 1, "DAYOFYEAR");
        direct("year", 1, "YEAR");
        direct("quarter", 1, "QUARTER");
        direct("month", 1, "MONTH");
        direct("day", 1, "DAY");
        direct("dayofmonth", 1, "DAY");
        direct("dayofweek", 1, "DAYOFWEEK");
        direct("weekday", 1, "WEEKDAY");
        direct("last_day", 1, "LAST_DAY");

        direct("date_add", 2, "ADDDATE");
        direct("date_sub", 2, "SUBDATE");
        direct("datediff", 2, "DATEDIFF");
        direct("months_between", 2, "MONTHS_BETWEEN");

        // ISO week: weeks start on Monday, week 1 has four or more days
        custom("weekofyear", 1, args -> Sql.func("WEEK", args.get(0), Sql.number(3)));

        custom("unix_millis", 1, args ->
            Sql.func("FLOOR", Sql.op("*", Sql.func("UNIX_TIMESTAMP", args.get(0)), Sql.number(1000))));
        custom("unix_seconds", 1, args -> Sql.func("FLOOR", Sql.func("UNIX_TIMESTAMP", args.get(0))));
        custom("date_from_unix_date", 1, args ->
            Sql.func("ADDDATE", Sql.func("DATE", Fragment.raw("'1970-01-01'")), args.get(0)));

        custom("add_months", 2, args ->
            Sql.func("DATE_ADD", args.get(0), Sql.keywords("INTERVAL", args.get(1), "MONTH")));
        custom("from_utc_timestamp", 2, args ->
            Sql.func("CONVERT_TZ", args.get(0), string("UTC"), args.get(1)));
        custom("to_utc_timestamp", 2, args ->
            Sql.func("CONVERT_TZ", args.get(0), args.get(1), string("UTC")));

        // convert_timezone(sourceTz, targetTz, ts)
        custom("convert_timezone", 3, args ->
            Sql.func("CONVERT_TZ", args.get(2), args.get(0), args.get(1)));
    }

    // ==================== Hash Functions ====================

    private static void initializeHashFunctions() {
        direct("md5", 1, "MD5");
        direct("sha1", 1, "SHA1");
        direct("sha", 1, "SHA1");
        direct("crc32", 1, "CRC32");
    }

    // ==================== Null Functions ====================

    private static void initializeNullFunctions() {
        direct("nullif", 2, "NULLIF");
        direct("nvl", 2, "COALESCE");
        direct("ifnull", 2, "COALESCE");
    }

    // ==================== Helpers ====================

    /**
     * {@code IF((value < 0), whenNegative, otherwise)}.
     */
    public static Fragment ifNegative(Fragment value, Fragment whenNegative, Fragment otherwise) {
        return Sql.func("IF", Sql.op("<", value, Sql.number(0)), whenNegative, otherwise);
    }

    private static Fragment expNegated(Fragment value) {
        return Sql.func("EXP", Sql.func("-", value));
    }

    private static Fragment string(String value) {
        return Fragment.bound(value, StringType.get());
    }
}
