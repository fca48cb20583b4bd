package com.sqlpush.fragment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shorthand builders for the fragment shapes the translator emits most.
 */
public final class Sql {

    private Sql() {
    }

    /**
     * {@code NAME(a, b, ...)}.
     */
    public static Fragment func(String name, Fragment... args) {
        return func(name, Arrays.asList(args));
    }

    public static Fragment func(String name, List<Fragment> args) {
        return Fragment.join("", Fragment.raw(name), Fragment.parenthesize(Fragment.join(args, ", ")));
    }

    /**
     * {@code (left OP right)}.
     */
    public static Fragment op(String operator, Fragment left, Fragment right) {
        return Fragment.parenthesize(Fragment.join(" ", left, Fragment.raw(operator), right));
    }

    /**
     * Space-joined sequence; strings become raw keywords.
     */
    public static Fragment keywords(Object... parts) {
        List<Fragment> fragments = new ArrayList<>(parts.length);
        for (Object part : parts) {
            if (part instanceof Fragment fragment) {
                fragments.add(fragment);
            } else if (part instanceof String keyword) {
                fragments.add(Fragment.raw(keyword));
            } else {
                throw new IllegalArgumentException("Expected Fragment or String keyword, got: " + part);
            }
        }
        return Fragment.join(fragments, " ");
    }

    /**
     * The SQL NULL keyword.
     */
    public static Fragment nullValue() {
        return Fragment.raw("NULL");
    }

    /**
     * Raw text of a fixed integer constant.
     */
    public static Fragment number(long value) {
        return Fragment.raw(Long.toString(value));
    }
}
