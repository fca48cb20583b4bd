package com.sqlpush.translator.rules;

import com.sqlpush.expression.Expression;
import com.sqlpush.expression.InSetExpression;
import com.sqlpush.expression.Literal;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.literal.LiteralEncoder;
import com.sqlpush.translator.ExpressionTranslator;

import java.util.Optional;

/**
 * Literals through {@link LiteralEncoder}, and membership in a set of
 * already evaluated constants: {@code (value IN (c1, c2, ...))}.
 */
public final class LiteralRule implements TranslationRule {

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (expression instanceof Literal literal) {
            return LiteralEncoder.encode(literal);
        }
        if (expression instanceof InSetExpression inSet) {
            Optional<Fragment> child = translator.translate(inSet.child());
            if (child.isEmpty()) {
                return Optional.empty();
            }
            return LiteralEncoder.encodeAll(inSet.values(), inSet.elementType())
                .map(values -> Sql.op("IN", child.get(), Fragment.parenthesize(values)));
        }
        return Optional.empty();
    }
}
