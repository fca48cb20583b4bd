package com.sqlpush.fragment;

import java.util.List;
import java.util.Objects;

/**
 * SQL text with {@code ?} placeholders plus the values to bind, in placeholder order.
 *
 * @param sql the SQL text
 * @param parameters the bound values
 */
public record RenderedStatement(String sql, List<BoundParameter> parameters) {

    public RenderedStatement {
        Objects.requireNonNull(sql, "sql must not be null");
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
    }

    public int placeholderCount() {
        return parameters.size();
    }
}
