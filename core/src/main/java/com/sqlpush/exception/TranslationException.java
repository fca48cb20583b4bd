package com.sqlpush.exception;

import com.sqlpush.expression.Expression;

/**
 * Exception thrown when an expression carries a value the remote dialect can
 * never accept, as opposed to a shape the translator merely does not support.
 *
 * <p>Unsupported shapes are reported as an empty {@code Optional} and never
 * thrown. This exception is reserved for invalid input, such as an unknown
 * weekday name handed to {@code week_diff}.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       Optional&lt;Fragment&gt; sql = translator.translate(expr);
 *   } catch (TranslationException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed expression: " + e.getFailedExpression());
 *   }
 * </pre>
 *
 * @see com.sqlpush.translator.ExpressionTranslator
 */
public class TranslationException extends RuntimeException {

    private final Expression failedExpression;

    /**
     * Creates a translation exception without expression context.
     *
     * @param message the error message
     */
    public TranslationException(String message) {
        this(message, (Expression) null);
    }

    /**
     * Creates a translation exception.
     *
     * @param message the error message
     * @param expression the expression being translated, or null if unknown
     */
    public TranslationException(String message, Expression expression) {
        super(message);
        this.failedExpression = expression;
    }

    /**
     * Creates a translation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param expression the expression being translated, or null if unknown
     */
    public TranslationException(String message, Throwable cause, Expression expression) {
        super(message, cause);
        this.failedExpression = expression;
    }

    /**
     * Returns a copy of this exception that carries the given expression.
     * Used by callers that know more context than the thrower did.
     *
     * @param expression the enclosing expression
     * @return this exception if it already has an expression, else a new one
     */
    public TranslationException withExpression(Expression expression) {
        if (failedExpression != null) {
            return this;
        }
        return new TranslationException(getMessage(), this, expression);
    }

    /**
     * Returns the expression that failed to translate.
     *
     * @return the failed expression, or null if not available
     */
    public Expression getFailedExpression() {
        return failedExpression;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        return "Failed to translate expression for pushdown: " + getMessage() + ". " +
               "Please check the constant arguments of the query.";
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Expression Translation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedExpression != null) {
            sb.append("Failed Expression Type: ").append(failedExpression.getClass().getName()).append("\n");
            sb.append("Expression String: ").append(failedExpression).append("\n");
        }

        if (getCause() != null && getCause() != this) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
