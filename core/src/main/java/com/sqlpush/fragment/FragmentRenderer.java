package com.sqlpush.fragment;

import java.util.List;

/**
 * Structural recursion from a fragment tree to text plus parameters.
 */
final class FragmentRenderer {

    private FragmentRenderer() {
    }

    static void render(Fragment fragment, StringBuilder sql, List<BoundParameter> parameters) {
        if (fragment instanceof Fragment.Raw raw) {
            sql.append(raw.text());
        } else if (fragment instanceof Fragment.Bound bound) {
            sql.append('?');
            parameters.add(new BoundParameter(bound.value(), bound.dataType()));
        } else if (fragment instanceof Fragment.Composite composite) {
            if (composite.parenthesized()) {
                sql.append('(');
            }
            List<Fragment> parts = composite.parts();
            for (int i = 0; i < parts.size(); i++) {
                if (i > 0) {
                    sql.append(composite.separator());
                }
                render(parts.get(i), sql, parameters);
            }
            if (composite.parenthesized()) {
                sql.append(')');
            }
        } else {
            throw new IllegalStateException("Unknown fragment: " + fragment.getClass().getName());
        }
    }
}
