package com.sqlpush.translator;

import com.sqlpush.expression.Expression;
import com.sqlpush.format.DateFormatTranspiler;
import com.sqlpush.fragment.Fragment;
import com.sqlpush.fragment.RenderedStatement;
import com.sqlpush.translator.rules.AggregateRule;
import com.sqlpush.translator.rules.AttributeRule;
import com.sqlpush.translator.rules.BinaryOperatorRule;
import com.sqlpush.translator.rules.ConditionalRule;
import com.sqlpush.translator.rules.LeafFunctionRule;
import com.sqlpush.translator.rules.LiteralRule;
import com.sqlpush.translator.rules.TemporalRewriteRule;
import com.sqlpush.translator.rules.TextFunctionRule;
import com.sqlpush.translator.rules.TranslationRule;
import com.sqlpush.translator.rules.UnaryOperatorRule;
import com.sqlpush.translator.rules.VariadicFunctionRule;
import com.sqlpush.translator.rules.WindowRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates host expression trees into remote-dialect fragments.
 *
 * <p>The translator walks an ordered list of {@link TranslationRule}s; the
 * first rule that renders a node wins. Rules translate children through this
 * translator, so an untranslatable child makes its parent untranslatable and
 * the caller can decide not to push the expression down.
 *
 * <p>Translation never throws for unsupported input, it returns empty. The
 * only exception is {@link com.sqlpush.exception.TranslationException} for
 * values that are invalid in any dialect.
 *
 * <p>Example usage:
 * <pre>
 *   ExpressionTranslator translator = new ExpressionTranslator(
 *       TranslationContext.builder().dialectVersion("7.5.0").build());
 *   Optional&lt;RenderedStatement&gt; sql = translator.compile(filterCondition);
 * </pre>
 *
 * <p>Instances hold only immutable state and can be shared between threads.
 */
public final class ExpressionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTranslator.class);

    private final TranslationContext context;
    private final DateFormatTranspiler formats;
    private final List<TranslationRule> rules;

    public ExpressionTranslator(TranslationContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.formats = new DateFormatTranspiler(context.transpileObserver());
        this.rules = List.of(
            new AttributeRule(),
            new LiteralRule(),
            new VariadicFunctionRule(),
            new AggregateRule(),
            new WindowRule(),
            new BinaryOperatorRule(),
            new UnaryOperatorRule(),
            new LeafFunctionRule(),
            new ConditionalRule(),
            new TemporalRewriteRule(),
            new TextFunctionRule()
        );
    }

    /**
     * Creates a translator with the default context.
     */
    public ExpressionTranslator() {
        this(TranslationContext.defaults());
    }

    public TranslationContext context() {
        return context;
    }

    public DateFormatTranspiler formats() {
        return formats;
    }

    /**
     * Translates one expression.
     *
     * @param expression the expression
     * @return the fragment, or empty if the expression cannot be rendered remotely
     * @throws com.sqlpush.exception.TranslationException if the expression holds an invalid constant
     */
    public Optional<Fragment> translate(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        for (TranslationRule rule : rules) {
            Optional<Fragment> fragment = rule.apply(expression, this);
            if (fragment.isPresent()) {
                if (logger.isTraceEnabled()) {
                    logger.trace("{} translated {}", rule.getClass().getSimpleName(), expression);
                }
                return fragment;
            }
        }
        logger.debug("No translation for {}: {}", expression.getClass().getSimpleName(), expression);
        return Optional.empty();
    }

    /**
     * Translates every expression of a list.
     *
     * @param expressions the expressions
     * @return the fragments in order, or empty if any expression fails
     */
    public Optional<List<Fragment>> translateEach(List<? extends Expression> expressions) {
        List<Fragment> fragments = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            Optional<Fragment> fragment = translate(expression);
            if (fragment.isEmpty()) {
                return Optional.empty();
            }
            fragments.add(fragment.get());
        }
        return Optional.of(fragments);
    }

    /**
     * Translates a list of expressions into one comma-separated fragment.
     *
     * @param expressions the expressions
     * @return the joined fragment, or empty if any expression fails
     */
    public Optional<Fragment> translateAll(List<? extends Expression> expressions) {
        return translateEach(expressions).map(fragments -> Fragment.join(fragments, ", "));
    }

    /**
     * Translates and renders an expression.
     *
     * @param expression the expression
     * @return SQL text with placeholders plus bound parameters, or empty if untranslatable
     */
    public Optional<RenderedStatement> compile(Expression expression) {
        return translate(expression).map(Fragment::render);
    }
}
