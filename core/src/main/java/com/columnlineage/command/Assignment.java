package com.columnlineage.command;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import java.util.Objects;

/**
 * One {@code column = value} of a MERGE action.
 */
public final class Assignment {

    private final AttributeReference key;
    private final Expression value;

    /**
     * Creates an assignment.
     *
     * @param key the target column written
     * @param value the value written, evaluated over the source row
     */
    public Assignment(AttributeReference key, Expression value) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public AttributeReference key() {
        return key;
    }

    public Expression value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Assignment)) return false;
        Assignment that = (Assignment) obj;
        return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key.name() + " = " + value;
    }
}
