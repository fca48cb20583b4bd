package com.sqlpush.format;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One rewrite of a date pattern: a regular expression and its replacement.
 *
 * @param pattern the compiled pattern
 * @param replacement the literal replacement text
 */
record FormatRule(Pattern pattern, String replacement) {

    FormatRule {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
    }

    static FormatRule of(String regex, String replacement) {
        return new FormatRule(Pattern.compile(regex), replacement);
    }

    String applyAll(String input) {
        return pattern.matcher(input).replaceAll(Matcher.quoteReplacement(replacement));
    }
}
