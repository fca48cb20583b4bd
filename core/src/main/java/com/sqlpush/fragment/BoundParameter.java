package com.sqlpush.fragment;

import com.sqlpush.types.DataType;

import java.util.Objects;

/**
 * A value bound to one {@code ?} placeholder of a rendered statement.
 *
 * @param value the value (may be null)
 * @param dataType the type the value must be bound as
 */
public record BoundParameter(Object value, DataType dataType) {

    public BoundParameter {
        Objects.requireNonNull(dataType, "dataType must not be null");
    }
}
