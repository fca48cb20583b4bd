package com.sqlpush.expression;

import com.sqlpush.types.BooleanType;
import com.sqlpush.types.DataType;

import java.util.Objects;

/**
 * Infix operator applied to two operands.
 *
 * <p>Arithmetic and bitwise results carry the type the host resolved for
 * them. Comparisons and connectives are always boolean.
 *
 * @param left the left operand
 * @param operator the operator
 * @param right the right operand
 * @param dataType the result type
 */
public record BinaryExpression(Expression left, Operator operator, Expression right, DataType dataType)
        implements Expression {

    /** Operator families, which decide the default result type. */
    public enum Family { ARITHMETIC, COMPARISON, LOGICAL, BITWISE }

    /**
     * Infix operators with their remote spelling.
     */
    public enum Operator {
        ADD("+", Family.ARITHMETIC),
        SUBTRACT("-", Family.ARITHMETIC),
        MULTIPLY("*", Family.ARITHMETIC),
        DIVIDE("/", Family.ARITHMETIC),
        MODULO("%", Family.ARITHMETIC),
        EQUAL("=", Family.COMPARISON),
        NOT_EQUAL("!=", Family.COMPARISON),
        NULL_SAFE_EQUAL("<=>", Family.COMPARISON),
        LESS_THAN("<", Family.COMPARISON),
        LESS_THAN_OR_EQUAL("<=", Family.COMPARISON),
        GREATER_THAN(">", Family.COMPARISON),
        GREATER_THAN_OR_EQUAL(">=", Family.COMPARISON),
        AND("AND", Family.LOGICAL),
        OR("OR", Family.LOGICAL),
        BITWISE_AND("&", Family.BITWISE),
        BITWISE_OR("|", Family.BITWISE),
        BITWISE_XOR("^", Family.BITWISE),
        SHIFT_LEFT("<<", Family.BITWISE),
        SHIFT_RIGHT(">>", Family.BITWISE);

        private final String symbol;
        private final Family family;

        Operator(String symbol, Family family) {
            this.symbol = symbol;
            this.family = family;
        }

        public String symbol() {
            return symbol;
        }

        public Family family() {
            return family;
        }

        boolean yieldsBoolean() {
            return family == Family.COMPARISON || family == Family.LOGICAL;
        }
    }

    public BinaryExpression {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(right, "right must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a node whose type follows from the operator: boolean for
     * comparisons and connectives, the left operand's type otherwise.
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this(left, operator, right, inferType(left, operator));
    }

    private static DataType inferType(Expression left, Operator operator) {
        Objects.requireNonNull(operator, "operator must not be null");
        if (operator.yieldsBoolean()) {
            return BooleanType.get();
        }
        return Objects.requireNonNull(left, "left must not be null").dataType();
    }

    @Override
    public boolean nullable() {
        switch (operator) {
            case NULL_SAFE_EQUAL:
                return false;
            case DIVIDE:
            case MODULO:
                // x / 0 is NULL remotely
                return true;
            default:
                return left.nullable() || right.nullable();
        }
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.ADD, right);
    }

    public static BinaryExpression subtract(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.SUBTRACT, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.MULTIPLY, right);
    }

    public static BinaryExpression divide(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.DIVIDE, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.NOT_EQUAL, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.AND, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.OR, right);
    }
}
