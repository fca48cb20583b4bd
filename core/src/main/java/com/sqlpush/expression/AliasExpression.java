package com.sqlpush.expression;

import com.sqlpush.types.DataType;

import java.util.Objects;

/**
 * Output name given to a projected expression, as in {@code price * qty AS total}.
 *
 * @param child the named expression
 * @param alias the output name, not empty
 */
public record AliasExpression(Expression child, String alias) implements Expression {

    public AliasExpression {
        Objects.requireNonNull(child, "child must not be null");
        if (Objects.requireNonNull(alias, "alias must not be null").isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
    }

    @Override
    public DataType dataType() {
        return child.dataType();
    }

    @Override
    public boolean nullable() {
        return child.nullable();
    }

    @Override
    public String toString() {
        return child + " AS " + alias;
    }
}
