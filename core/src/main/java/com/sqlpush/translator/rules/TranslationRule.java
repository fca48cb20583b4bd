package com.sqlpush.translator.rules;

import com.sqlpush.expression.Expression;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.translator.ExpressionTranslator;

import java.util.Optional;

/**
 * One pattern of the recursive translator.
 *
 * <p>A rule returns empty when the node does not have its shape, when the
 * dialect version does not support it, or when one of the children it needs
 * is untranslatable. The translator then tries the next rule.
 */
@FunctionalInterface
public interface TranslationRule {

    /**
     * Attempts to render a node.
     *
     * @param expression the node
     * @param translator the translator to use for children
     * @return the fragment, or empty if this rule does not apply
     */
    Optional<Fragment> apply(Expression expression, ExpressionTranslator translator);
}
