package com.sqlpush.expression;

import com.sqlpush.types.BooleanType;
import com.sqlpush.types.DataType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Membership test against a set of constant values the host engine has
 * already evaluated (the optimized form of a large IN list).
 *
 * <p>The values are raw host values of {@code elementType}, not expressions.
 * Every value must be encodable as a literal for the test to be translated.
 */
public final class InSetExpression implements Expression {

    private final Expression child;
    private final List<Object> values;
    private final DataType elementType;

    public InSetExpression(Expression child, Collection<?> values, DataType elementType) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.values = new ArrayList<>(Objects.requireNonNull(values, "values must not be null"));
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
    }

    public Expression child() {
        return child;
    }

    public List<Object> values() {
        return Collections.unmodifiableList(values);
    }

    public DataType elementType() {
        return elementType;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return child.nullable() || values.contains(null);
    }

    @Override
    public String toString() {
        return child + " INSET " + values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InSetExpression)) return false;
        InSetExpression that = (InSetExpression) obj;
        return child.equals(that.child) &&
               values.equals(that.values) &&
               elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, values, elementType);
    }
}
