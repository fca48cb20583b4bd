package com.sqlpush.expression;

import com.sqlpush.types.DataType;

import java.util.Objects;

/**
 * Reference to a column of the input relation.
 *
 * <p>{@code exprId} is the host's stable identity for the column. Name and
 * qualifier only describe it; the remote rendering is chosen by the
 * {@link com.sqlpush.translator.ColumnResolver} of the translation context.
 *
 * @param exprId identity of the column within the plan
 * @param columnName the column name, not empty
 * @param qualifier the relation qualifier, or null
 * @param dataType the column type
 * @param nullable whether the column may hold NULL
 */
public record ColumnReference(long exprId, String columnName, String qualifier,
                              DataType dataType, boolean nullable) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(columnName, "columnName must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        if (columnName.isEmpty()) {
            throw new IllegalArgumentException("columnName must not be empty");
        }
    }

    /** Unqualified and nullable. */
    public ColumnReference(long exprId, String columnName, DataType dataType) {
        this(exprId, columnName, null, dataType, true);
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    @Override
    public String toString() {
        return (qualifier == null ? columnName : qualifier + "." + columnName) + "#" + exprId;
    }
}
