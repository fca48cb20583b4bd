package com.sqlpush.expression;

import com.sqlpush.types.DataType;

/**
 * Base interface for all expression nodes handed to the translator.
 *
 * <p>Expressions are produced by the host query engine, already type-resolved,
 * and are never modified by the translator. The set of node shapes is closed:
 * <ul>
 *   <li>Leaves: {@link Literal}, {@link ColumnReference}</li>
 *   <li>Operators: {@link UnaryExpression}, {@link BinaryExpression}</li>
 *   <li>Calls: {@link FunctionCall}, {@link AggregateExpression}, {@link WindowExpression}</li>
 *   <li>Conditionals: {@link IfExpression}, {@link CaseWhenExpression}</li>
 *   <li>Predicates: {@link InExpression}, {@link InSetExpression}, {@link LikeExpression}</li>
 *   <li>Wrappers: {@link CastExpression}, {@link AliasExpression}</li>
 * </ul>
 *
 * <p>{@code toString()} on every node is a debugging aid only. SQL text is
 * produced exclusively by {@link com.sqlpush.translator.ExpressionTranslator}.
 */
public sealed interface Expression
    permits Literal, ColumnReference, AliasExpression, UnaryExpression,
            BinaryExpression, FunctionCall, IfExpression, CaseWhenExpression,
            InExpression, InSetExpression, LikeExpression, CastExpression,
            AggregateExpression, WindowExpression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();
}
