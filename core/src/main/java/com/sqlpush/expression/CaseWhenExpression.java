package com.sqlpush.expression;

import com.sqlpush.types.DataType;
import com.sqlpush.types.NullType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Searched {@code CASE}: the first branch whose condition holds supplies the
 * value, otherwise the ELSE value, or NULL when there is none.
 */
public final class CaseWhenExpression implements Expression {

    /**
     * One {@code WHEN condition THEN value} arm.
     *
     * @param condition the boolean condition
     * @param value the value produced when the condition holds
     */
    public record Branch(Expression condition, Expression value) {
        public Branch {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    private final List<Branch> branches;
    private final Expression elseValue;

    /**
     * @param branches the arms in evaluation order, at least one
     * @param elseValue the ELSE value, or null
     */
    public CaseWhenExpression(List<Branch> branches, Expression elseValue) {
        if (Objects.requireNonNull(branches, "branches must not be null").isEmpty()) {
            throw new IllegalArgumentException("CASE needs at least one WHEN branch");
        }
        this.branches = List.copyOf(branches);
        this.elseValue = elseValue;
    }

    /**
     * Pairs conditions with values by position.
     *
     * @throws IllegalArgumentException if the lists differ in length
     */
    public CaseWhenExpression(List<Expression> conditions, List<Expression> values, Expression elseValue) {
        this(zip(conditions, values), elseValue);
    }

    private static List<Branch> zip(List<Expression> conditions, List<Expression> values) {
        Objects.requireNonNull(conditions, "conditions must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (conditions.size() != values.size()) {
            throw new IllegalArgumentException(
                conditions.size() + " conditions given for " + values.size() + " values");
        }
        List<Branch> branches = new ArrayList<>(conditions.size());
        for (int i = 0; i < conditions.size(); i++) {
            branches.add(new Branch(conditions.get(i), values.get(i)));
        }
        return branches;
    }

    public List<Branch> branches() {
        return branches;
    }

    public Optional<Expression> elseBranch() {
        return Optional.ofNullable(elseValue);
    }

    /** The first branch value that is not an untyped NULL decides the type. */
    @Override
    public DataType dataType() {
        return branches.stream()
            .map(branch -> branch.value().dataType())
            .filter(type -> !(type instanceof NullType))
            .findFirst()
            .orElseGet(() -> elseValue != null ? elseValue.dataType() : NullType.get());
    }

    @Override
    public boolean nullable() {
        return elseValue == null || elseValue.nullable()
            || branches.stream().anyMatch(branch -> branch.value().nullable());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof CaseWhenExpression other
            && branches.equals(other.branches)
            && Objects.equals(elseValue, other.elseValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(branches, elseValue);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("case");
        for (Branch branch : branches) {
            sb.append(" when ").append(branch.condition()).append(" then ").append(branch.value());
        }
        if (elseValue != null) {
            sb.append(" else ").append(elseValue);
        }
        return sb.append(" end").toString();
    }
}
