package com.sqlpush.expression;

import com.sqlpush.types.DataType;

import java.util.Objects;

/**
 * Expression representing a two-way conditional: {@code IF(predicate, trueValue, falseValue)}.
 */
public final class IfExpression implements Expression {

    private final Expression predicate;
    private final Expression trueValue;
    private final Expression falseValue;

    public IfExpression(Expression predicate, Expression trueValue, Expression falseValue) {
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
        this.trueValue = Objects.requireNonNull(trueValue, "trueValue must not be null");
        this.falseValue = Objects.requireNonNull(falseValue, "falseValue must not be null");
    }

    public Expression predicate() {
        return predicate;
    }

    public Expression trueValue() {
        return trueValue;
    }

    public Expression falseValue() {
        return falseValue;
    }

    @Override
    public DataType dataType() {
        return trueValue.dataType();
    }

    @Override
    public boolean nullable() {
        return trueValue.nullable() || falseValue.nullable();
    }

    @Override
    public String toString() {
        return "if(" + predicate + ", " + trueValue + ", " + falseValue + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IfExpression)) return false;
        IfExpression that = (IfExpression) obj;
        return predicate.equals(that.predicate) &&
               trueValue.equals(that.trueValue) &&
               falseValue.equals(that.falseValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicate, trueValue, falseValue);
    }
}
