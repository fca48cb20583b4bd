package com.sqlpush.fragment;

import com.sqlpush.types.DataType;
import com.sqlpush.types.NullType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A piece of remote-dialect SQL.
 *
 * <p>Fragments form an immutable tree with three kinds of nodes:
 * <ul>
 *   <li>{@link Raw}: fixed text written by the translator itself</li>
 *   <li>{@link Bound}: a {@code ?} placeholder plus one value bound out of band</li>
 *   <li>{@link Composite}: ordered children joined by a separator</li>
 * </ul>
 *
 * <p>Text that comes from user data (string contents, dates, patterns) must
 * always enter a fragment as {@link Bound}; only identifiers may be turned
 * into {@link Raw} text, and only through {@link #identifier(String)}.
 */
public sealed interface Fragment {

    /**
     * Fixed SQL text.
     */
    record Raw(String text) implements Fragment {
        public Raw {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * Placeholder for a value bound as a statement parameter.
     */
    record Bound(Object value, DataType dataType) implements Fragment {
        public Bound {
            Objects.requireNonNull(dataType, "dataType must not be null");
        }
    }

    /**
     * Ordered children joined by {@code separator}, optionally wrapped in parentheses.
     */
    record Composite(List<Fragment> parts, String separator, boolean parenthesized) implements Fragment {
        public Composite {
            parts = List.copyOf(Objects.requireNonNull(parts, "parts must not be null"));
            Objects.requireNonNull(separator, "separator must not be null");
        }
    }

    // ==================== Factory Methods ====================

    static Fragment raw(String text) {
        return new Raw(text);
    }

    static Fragment bound(Object value, DataType dataType) {
        return new Bound(value, dataType == null ? NullType.get() : dataType);
    }

    /**
     * Creates a back-quoted identifier. Embedded backticks are doubled.
     *
     * @param name the identifier
     * @return the quoted identifier fragment
     */
    static Fragment identifier(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return new Raw("`" + name.replace("`", "``") + "`");
    }

    static Fragment concat(Fragment left, Fragment right, String separator) {
        return new Composite(List.of(left, right), separator, false);
    }

    static Fragment join(List<Fragment> parts, String separator) {
        return new Composite(parts, separator, false);
    }

    static Fragment join(String separator, Fragment... parts) {
        return new Composite(Arrays.asList(parts), separator, false);
    }

    static Fragment parenthesize(Fragment fragment) {
        return new Composite(List.of(fragment), "", true);
    }

    // ==================== Rendering ====================

    /**
     * Renders this fragment into SQL text and its parameter list.
     *
     * @return the rendered statement
     */
    default RenderedStatement render() {
        StringBuilder sql = new StringBuilder();
        List<BoundParameter> parameters = new ArrayList<>();
        FragmentRenderer.render(this, sql, parameters);
        return new RenderedStatement(sql.toString(), parameters);
    }

    /**
     * Renders the SQL text only, for logging and tests.
     *
     * @return the SQL text with {@code ?} placeholders
     */
    default String sql() {
        return render().sql();
    }
}
