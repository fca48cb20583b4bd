package com.sqlpush.format;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Transpiles host date patterns ({@code yyyy-MM-dd HH:mm:ss}) into the two
 * notations of the remote dialect.
 *
 * <p>Symbol mode applies an ordered table of replace-all rules, each over the
 * output of the previous one. Rule order matters: composite patterns such as
 * {@code HH:mm:ss} are replaced before their parts, and longer letter runs
 * before shorter ones. The bare single-letter rules skip letters already
 * preceded by {@code %} so earlier output is not rewritten.
 *
 * <p>Specifier mode is a single left-to-right scan: at each position the first
 * matching rule wins and the emitted text is never scanned again, so the
 * {@code H} in an emitted {@code MONTH} stays as is.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class DateFormatTranspiler {

    private static final List<FormatRule> SYMBOL_RULES = List.of(
        FormatRule.of("HH:mm:ss", "%T"),
        FormatRule.of("hh:mm:ss a", "%r"),
        FormatRule.of("Y{4,}|y{4,}", "%Y"),
        FormatRule.of("Y{2}|y{2}", "%y"),
        FormatRule.of("D{1,3}", "%j"),
        FormatRule.of("M{4,}", "%M"),
        FormatRule.of("M{3,}", "%b"),
        FormatRule.of("M{2,}", "%m"),
        FormatRule.of("(?<!%)M+", "%c"),
        FormatRule.of("d{2,}", "%d"),
        FormatRule.of("(?<!%)d+", "%e"),
        FormatRule.of("H{2,}", "%H"),
        FormatRule.of("(?<!%)H+", "%k"),
        FormatRule.of("h{2,}", "%h"),
        FormatRule.of("(?<!%)h+", "%l"),
        FormatRule.of("(?<!%)m{2,}", "%i"),
        FormatRule.of("s+", "%s"),
        FormatRule.of("S+", "%f"),
        FormatRule.of("a", "%p"),
        FormatRule.of("w+", "%v"),
        FormatRule.of("E{4,}", "%W"),
        FormatRule.of("E{1,3}", "%a")
    );

    private static final List<FormatRule> SPECIFIER_RULES = List.of(
        FormatRule.of("y{4}", "YYYY"),
        FormatRule.of("y{2}", "YY"),
        FormatRule.of("M{4}", "MONTH"),
        FormatRule.of("M{3}", "MON"),
        FormatRule.of("E{1,3}", "DY"),
        FormatRule.of("d{1,2}", "DD"),
        FormatRule.of("H{1,2}", "HH24"),
        FormatRule.of("h{1,2}", "HH12"),
        FormatRule.of("m{1,2}", "MI"),
        FormatRule.of("s{1,2}", "SS"),
        FormatRule.of("a", "AM")
    );

    private final TranspileObserver observer;

    /**
     * Creates a transpiler that logs every transpiled pattern.
     */
    public DateFormatTranspiler() {
        this(new LoggingTranspileObserver());
    }

    public DateFormatTranspiler(TranspileObserver observer) {
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    /**
     * Transpiles a host pattern to percent symbols.
     *
     * <p>Examples:
     * <pre>
     *   yyyy-MM-dd HH:mm:ss → %Y-%m-%d %T
     *   EEE                 → %a
     *   M                   → %c
     * </pre>
     *
     * @param pattern the host date pattern
     * @return the symbol pattern
     */
    public String toSymbols(String pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        String result = pattern;
        for (FormatRule rule : SYMBOL_RULES) {
            result = rule.applyAll(result);
        }
        observer.onTranspile(FormatMode.SYMBOLS, pattern, result);
        return result;
    }

    /**
     * Transpiles a host pattern to specifiers.
     *
     * <p>Examples:
     * <pre>
     *   yyyy-MM-dd → YYYY-MM-DD
     *   MMMM       → MONTH
     *   hh:mm a    → HH12:MI AM
     * </pre>
     *
     * @param pattern the host date pattern
     * @return the specifier pattern
     */
    public String toSpecifiers(String pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        StringBuilder result = new StringBuilder(pattern.length() + 8);
        int position = 0;
        while (position < pattern.length()) {
            int consumed = 0;
            for (FormatRule rule : SPECIFIER_RULES) {
                Matcher matcher = rule.pattern().matcher(pattern);
                matcher.region(position, pattern.length());
                if (matcher.lookingAt()) {
                    result.append(rule.replacement());
                    consumed = matcher.end() - position;
                    break;
                }
            }
            if (consumed == 0) {
                result.append(pattern.charAt(position));
                consumed = 1;
            }
            position += consumed;
        }
        String output = result.toString();
        observer.onTranspile(FormatMode.SPECIFIERS, pattern, output);
        return output;
    }

    /**
     * Transpiles a host pattern to the requested notation.
     *
     * @param pattern the host date pattern
     * @param mode the target notation
     * @return the transpiled pattern
     */
    public String transpile(String pattern, FormatMode mode) {
        return mode == FormatMode.SYMBOLS ? toSymbols(pattern) : toSpecifiers(pattern);
    }
}
