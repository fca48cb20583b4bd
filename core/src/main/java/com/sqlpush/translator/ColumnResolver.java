package com.sqlpush.translator;

import com.sqlpush.expression.ColumnReference;
import com.sqlpush.fragment.Fragment;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders column references as remote identifiers.
 */
@FunctionalInterface
public interface ColumnResolver {

    Fragment resolve(ColumnReference column);

    /**
     * Back-quoted {@code `qualifier`.`name`}, or just {@code `name`} when unqualified.
     */
    static ColumnResolver byName() {
        return column -> {
            Fragment name = Fragment.identifier(column.columnName());
            if (!column.isQualified()) {
                return name;
            }
            return Fragment.concat(Fragment.identifier(column.qualifier()), name, ".");
        };
    }

    /**
     * Renames columns by expression id, for plans whose output columns were
     * aliased on the remote side. Unmapped ids fall back to {@link #byName()}.
     *
     * @param namesById remote column name per expression id
     * @return the resolver
     */
    static ColumnResolver mapping(Map<Long, String> namesById) {
        Map<Long, String> names = new HashMap<>(Objects.requireNonNull(namesById, "namesById must not be null"));
        ColumnResolver fallback = byName();
        return column -> {
            String name = names.get(column.exprId());
            return name != null ? Fragment.identifier(name) : fallback.resolve(column);
        };
    }
}
