package com.sqlpush.translator.rules;

import com.sqlpush.expression.Expression;
import com.sqlpush.expression.FunctionCall;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.Sql;
import com.sqlpush.functions.FunctionRegistry;
import com.sqlpush.functions.FunctionTranslator;
import com.sqlpush.translator.ExpressionTranslator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * String functions with a constant argument, and functions of three or
 * four arguments from the {@link FunctionRegistry}.
 *
 * <ul>
 *   <li>{@code trim(s[, chars])} → {@code TRIM(BOTH [chars] FROM s)}; ltrim / rtrim use LEADING / TRAILING</li>
 *   <li>{@code translate(s, from, to)} → one REPLACE per character of {@code from}</li>
 *   <li>{@code like_any(s, p1, p2, ...)} → {@code ((s LIKE p1) OR (s LIKE p2))}; like_all joins with AND</li>
 * </ul>
 */
public final class TextFunctionRule implements TranslationRule {

    @Override
    public Optional<Fragment> apply(Expression expression, ExpressionTranslator translator) {
        if (!(expression instanceof FunctionCall call)) {
            return Optional.empty();
        }
        String name = call.normalizedName();
        int arity = call.argumentCount();
        if ((name.equals("trim") || name.equals("ltrim") || name.equals("rtrim")) && (arity == 1 || arity == 2)) {
            return trim(call, translator);
        }
        if (name.equals("translate") && arity == 3) {
            return translate(call, translator);
        }
        if ((name.equals("like_any") || name.equals("like_all")) && arity >= 2) {
            return likePatterns(call, name.equals("like_any") ? "OR" : "AND", translator);
        }
        if (arity == 3 || arity == 4) {
            Optional<FunctionTranslator> function = FunctionRegistry.lookup(call.functionName(), arity);
            if (function.isPresent()) {
                return RuleSupport.arguments(call, translator).map(args -> function.get().translate(args));
            }
        }
        return Optional.empty();
    }

    private static Optional<Fragment> trim(FunctionCall call, ExpressionTranslator translator) {
        String name = call.normalizedName();
        Optional<Fragment> source = translator.translate(call.argument(0));
        if (source.isEmpty()) {
            return Optional.empty();
        }
        if (call.argumentCount() == 1) {
            switch (name) {
                case "ltrim":
                    return Optional.of(Sql.func("LTRIM", source.get()));
                case "rtrim":
                    return Optional.of(Sql.func("RTRIM", source.get()));
                default:
                    return Optional.of(Sql.func("TRIM", Sql.keywords("BOTH", "FROM", source.get())));
            }
        }
        Optional<String> characters = RuleSupport.stringLiteral(call.argument(1));
        if (characters.isEmpty()) {
            return Optional.empty();
        }
        String side = name.equals("ltrim") ? "LEADING" : name.equals("rtrim") ? "TRAILING" : "BOTH";
        return Optional.of(Sql.func("TRIM",
            Sql.keywords(side, RuleSupport.string(characters.get()), "FROM", source.get())));
    }

    // translate('abc', 'ab', 'x') = REPLACE(REPLACE('abc', 'a', 'x'), 'b', '')
    private static Optional<Fragment> translate(FunctionCall call, ExpressionTranslator translator) {
        Optional<String> matching = RuleSupport.stringLiteral(call.argument(1));
        Optional<String> replacing = RuleSupport.stringLiteral(call.argument(2));
        if (matching.isEmpty() || replacing.isEmpty()) {
            return Optional.empty();
        }
        return translator.translate(call.argument(0)).map(source -> {
            String from = matching.get();
            String to = replacing.get();
            Fragment result = source;
            for (int i = 0; i < Math.max(from.length(), to.length()); i++) {
                String match = i < from.length() ? String.valueOf(from.charAt(i)) : "";
                String replacement = i < to.length() ? String.valueOf(to.charAt(i)) : "";
                result = Sql.func("REPLACE", result, RuleSupport.string(match), RuleSupport.string(replacement));
            }
            return result;
        });
    }

    private static Optional<Fragment> likePatterns(FunctionCall call, String connective,
                                                   ExpressionTranslator translator) {
        List<String> patterns = new ArrayList<>();
        for (int i = 1; i < call.argumentCount(); i++) {
            Optional<String> pattern = RuleSupport.stringLiteral(call.argument(i));
            if (pattern.isEmpty()) {
                return Optional.empty();
            }
            patterns.add(pattern.get());
        }
        return translator.translate(call.argument(0)).map(value -> {
            Fragment result = Sql.op("LIKE", value, RuleSupport.string(patterns.get(0)));
            for (int i = 1; i < patterns.size(); i++) {
                result = Sql.op(connective, result, Sql.op("LIKE", value, RuleSupport.string(patterns.get(i))));
            }
            return result;
        });
    }
}
