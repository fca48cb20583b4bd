package com.sqlpush.expression;

import com.sqlpush.types.DataType;

import java.util.Objects;

/**
 * Conversion of a value to another host type.
 *
 * @param expression the value being converted
 * @param targetType the type converted to, which is also this node's type
 */
public record CastExpression(Expression expression, DataType targetType) implements Expression {

    public CastExpression {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(targetType, "targetType must not be null");
    }

    @Override
    public DataType dataType() {
        return targetType;
    }

    @Override
    public boolean nullable() {
        return expression.nullable();
    }

    @Override
    public String toString() {
        return "cast(" + expression + " as " + targetType + ")";
    }
}
