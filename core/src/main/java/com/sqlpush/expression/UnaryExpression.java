package com.sqlpush.expression;

import com.sqlpush.types.BooleanType;
import com.sqlpush.types.DataType;

import java.util.Objects;

/**
 * Prefix or postfix operator applied to one operand.
 *
 * @param operator the operator
 * @param operand the operand
 */
public record UnaryExpression(Operator operator, Expression operand) implements Expression {

    /**
     * Unary operators. {@code IS NULL} and {@code IS NOT NULL} are postfix.
     */
    public enum Operator {
        NEGATE("-"),
        POSITIVE("+"),
        BITWISE_NOT("~"),
        NOT("NOT"),
        IS_NULL("IS NULL"),
        IS_NOT_NULL("IS NOT NULL");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isPostfix() {
            return this == IS_NULL || this == IS_NOT_NULL;
        }
    }

    public UnaryExpression {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
    }

    @Override
    public DataType dataType() {
        return operator == Operator.NOT || operator.isPostfix() ? BooleanType.get() : operand.dataType();
    }

    @Override
    public boolean nullable() {
        return !operator.isPostfix() && operand.nullable();
    }

    @Override
    public String toString() {
        return operator.isPostfix()
            ? "(" + operand + " " + operator.symbol() + ")"
            : "(" + operator.symbol() + " " + operand + ")";
    }

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }

    public static UnaryExpression isNotNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NOT_NULL, operand);
    }
}
