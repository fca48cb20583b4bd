package com.sqlpush.translator.rules;

import com.sqlpush.expression.AliasExpression;
import com.sqlpush.expression.ColumnReference;
import com.sqlpush.expression.Expression;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.translator.ExpressionTranslator;

import java.util.Optional;

/**
 * Column references through the context's resolver; aliases as {@code child AS `name`}.
 */
public final class AttributeRule implements TranslationRule {

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (expression instanceof ColumnReference column) {
            return Optional.of(translator.context().columnResolver().resolve(column));
        }
        if (expression instanceof AliasExpression alias) {
            return translator.translate(alias.child())
                .map(child -> Sql.keywords(child, "AS", Fragment.identifier(alias.alias())));
        }
        return Optional.empty();
    }
}
