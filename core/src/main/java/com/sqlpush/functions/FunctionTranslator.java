package com.sqlpush.functions;

import com.sqlpush.fragment.Fragment;

import java.util.List;

/**
 * Renders a function call whose remote form is not a same-arity call of
 * another function name.
 */
@FunctionalInterface
public interface FunctionTranslator {

    /**
     * Renders the call.
     *
     * @param args the already translated arguments
     * @return the rendered call
     */
    Fragment translate(List<Fragment> args);
}
