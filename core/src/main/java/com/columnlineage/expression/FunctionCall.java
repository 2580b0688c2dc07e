package com.columnlineage.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Non-aggregate function call; derives from every column among its arguments.
 *
 * <p>Examples:
 * <pre>
 *   upper(name)                         -- string function
 *   hash(hash(col1))                    -- nested call
 *   concat(first_name, ' ', last_name)  -- multi-argument function
 *   unix_timestamp()                    -- no arguments, no lineage
 * </pre>
 *
 * <p>Aggregate calls are {@link AggregateExpression}.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;

    public FunctionCall(String functionName, List<Expression> arguments) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    /**
     * Creates a function call expression.
     *
     * @param functionName the function name
     * @param arguments the function arguments
     * @return the function call
     */
    public static FunctionCall of(String functionName, Expression... arguments) {
        return new FunctionCall(functionName, List.of(arguments));
    }

    /**
     * Returns the function name.
     *
     * @return the function name
     */
    public String functionName() {
        return functionName;
    }

    /**
     * Returns the function arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public List<Expression> children() {
        return arguments();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(functionName).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }
}
