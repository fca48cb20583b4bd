package com.sqlpush.expression;

import com.sqlpush.types.BooleanType;
import com.sqlpush.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * Membership test against a list of expressions, optionally negated.
 *
 * <p>The list may be empty; such a test has no remote rendering. Membership
 * in a set of constants the host has already evaluated is an
 * {@link InSetExpression}.
 *
 * @param testExpr the value looked up
 * @param values the candidates
 * @param negated true for {@code NOT IN}
 */
public record InExpression(Expression testExpr, List<Expression> values, boolean negated) implements Expression {

    public InExpression {
        Objects.requireNonNull(testExpr, "testExpr must not be null");
        values = List.copyOf(Objects.requireNonNull(values, "values must not be null"));
    }

    public InExpression(Expression testExpr, List<Expression> values) {
        this(testExpr, values, false);
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return testExpr.nullable() || values.stream().anyMatch(Expression::nullable);
    }

    @Override
    public String toString() {
        return testExpr + (negated ? " NOT IN " : " IN ") + values;
    }
}
