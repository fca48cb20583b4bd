package com.sqlpush.translator.rules;

import com.sqlpush.exception.TranslationException;
import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.rewrite.TemporalRewrites;
import com.sqlpush.translator.ExpressionTranslator;

import java.util.Optional;

/**
 * Composite temporal functions, desugared by {@link TemporalRewrites} and
 * translated again.
 */
public final class TemporalRewriteRule implements TranslationRule {

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (!(expression instanceof FunctionCall call)) {
            return Optional.empty();
        }
        Optional<Expression> rewritten;
        try {
            rewritten = TemporalRewrites.rewrite(call);
        } catch (TranslationException e) {
            throw e.withExpression(call);
        }
        return rewritten.flatMap(translator::translate);
    }
}
