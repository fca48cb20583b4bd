package com.sqlpush.translator.rules;

import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.expression.Literal;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.translator.ExpressionTranslator;
import com.sqlpush.types.StringType;

import java.util.List;
import java.util.Optional;

/**
 * Helpers shared by the translation rules.
 */
final class RuleSupport {

    private RuleSupport() {
    }

    /**
     * Returns the value of a non-null string literal.
     */
    static Optional<String> stringLiteral(Expression expression) {
        if (expression instanceof Literal literal && literal.value() instanceof String value) {
            return Optional.of(value);
        }
        return Optional.empty();
    }

    /**
     * Returns the value of a non-null integral literal that fits an int.
     */
    static Optional<Integer> intLiteral(Expression expression) {
        if (expression instanceof Literal literal && literal.value() instanceof Number number
                && (number instanceof Integer || number instanceof Short
                    || number instanceof Byte || number instanceof Long)) {
            long value = number.longValue();
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return Optional.of((int) value);
            }
        }
        return Optional.empty();
    }

    static Optional<List<Fragment>> arguments(FunctionCall call, ExpressionTranslator translator) {
        return translator.translateEach(call.arguments());
    }

    static Fragment string(String value) {
        return Fragment.bound(value, StringType.get());
    }
}
