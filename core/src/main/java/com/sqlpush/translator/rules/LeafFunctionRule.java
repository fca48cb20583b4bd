package com.sqlpush.translator.rules;

import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.translator.DialectLimits;
import com.sqlpush.translator.ExpressionTranslator;

import java.util.Optional;

/**
 * Functions without arguments.
 */
public final class LeafFunctionRule implements TranslationRule {

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (!(expression instanceof FunctionCall call) || call.argumentCount() != 0) {
            return Optional.empty();
        }
        switch (call.normalizedName()) {
            case "current_date":
                return raw("CURRENT_DATE()");
            case "current_timestamp":
                return raw("NOW(6)");
            case "now":
                return raw("NOW()");
            case "current_timezone":
                return raw("@@SYSTEM_TIME_ZONE");
            case "pi":
                return raw("PI()");
            case "e":
                return raw(Double.toString(Math.E));
            case "uuid":
                if (!translator.context().supports(DialectLimits.UUID_SINCE)) {
                    return Optional.empty();
                }
                return raw("UUID()");
            default:
                return Optional.empty();
        }
    }

    private static Optional<Fragment> raw(String text) {
        return Optional.of(Fragment.raw(text));
    }
}
