package com.sqlpush.expression;

import com.sqlpush.types.BooleanType;
import com.sqlpush.types.DataType;

import java.util.Objects;

/**
 * Pattern matching predicate.
 *
 * <ul>
 *   <li>{@link Kind#LIKE}: SQL wildcard matching with {@code %} and {@code _};
 *       the escape character defaults to backslash</li>
 *   <li>{@link Kind#RLIKE}: regular expression search. The host matches the
 *       regex anywhere in the value starting from the first character, so the
 *       remote rendering anchors it explicitly</li>
 * </ul>
 */
public final class LikeExpression implements Expression {

    public enum Kind { LIKE, RLIKE }

    public static final char DEFAULT_ESCAPE = '\\';

    private final Expression value;
    private final Expression pattern;
    private final Kind kind;
    private final char escapeChar;

    public LikeExpression(Expression value, Expression pattern, Kind kind, char escapeChar) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.escapeChar = escapeChar;
    }

    public static LikeExpression like(Expression value, Expression pattern) {
        return new LikeExpression(value, pattern, Kind.LIKE, DEFAULT_ESCAPE);
    }

    public static LikeExpression rlike(Expression value, Expression pattern) {
        return new LikeExpression(value, pattern, Kind.RLIKE, DEFAULT_ESCAPE);
    }

    public Expression value() {
        return value;
    }

    public Expression pattern() {
        return pattern;
    }

    public Kind kind() {
        return kind;
    }

    public char escapeChar() {
        return escapeChar;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return value.nullable() || pattern.nullable();
    }

    @Override
    public String toString() {
        return "(" + value + " " + kind + " " + pattern + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LikeExpression)) return false;
        LikeExpression that = (LikeExpression) obj;
        return kind == that.kind &&
               escapeChar == that.escapeChar &&
               value.equals(that.value) &&
               pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, pattern, kind, escapeChar);
    }
}
