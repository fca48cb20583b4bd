package com.sqlpush.expression;

import com.sqlpush.types.DataType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Call of a host scalar function by name, e.g. {@code upper(name)},
 * {@code atan2(y, x)} or {@code date_format(ts, 'yyyy')}.
 *
 * <p>Names are host names and match case-insensitively.
 *
 * @param functionName the host function name
 * @param arguments the arguments in call order
 * @param dataType the resolved result type
 * @param nullable whether the result may be NULL
 */
public record FunctionCall(String functionName, List<Expression> arguments,
                           DataType dataType, boolean nullable) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(functionName, "functionName must not be null");
        if (functionName.isBlank()) {
            throw new IllegalArgumentException("functionName must not be blank");
        }
        arguments = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null")));
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType) {
        this(functionName, arguments, dataType, true);
    }

    public static FunctionCall of(String functionName, DataType dataType, Expression... arguments) {
        return new FunctionCall(functionName, Arrays.asList(arguments), dataType);
    }

    /** Lower-case name used as the registry key. */
    public String normalizedName() {
        return functionName.toLowerCase(Locale.ROOT);
    }

    public Expression argument(int index) {
        return arguments.get(index);
    }

    public int argumentCount() {
        return arguments.size();
    }

    /**
     * Returns whether this call has the given name, ignoring case, and arity.
     */
    public boolean is(String name, int arity) {
        return arguments.size() == arity && functionName.equalsIgnoreCase(name);
    }

    @Override
    public String toString() {
        return arguments.stream()
            .map(String::valueOf)
            .collect(Collectors.joining(", ", functionName + "(", ")"));
    }
}
