package com.columnlineage.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a constant value.
 *
 * <p>Literals never carry lineage: a column computed only from literals maps
 * to the empty source set.
 *
 * <p>Examples:
 * <pre>
 *   42
 *   'hello'
 *   NULL
 * </pre>
 */
public final class Literal implements Expression {

    /** The untyped NULL literal, used to null-fill grouping-set branches. */
    public static final Literal NULL = new Literal(null);

    private final Object value;

    /**
     * Creates a literal.
     *
     * @param value the constant value (may be null)
     */
    public Literal(Object value) {
        this.value = value;
    }

    /**
     * Creates a literal.
     *
     * @param value the constant value
     * @return the literal
     */
    public static Literal of(Object value) {
        return value == null ? NULL : new Literal(value);
    }

    /**
     * Returns the constant value.
     *
     * @return the value, or null for the NULL literal
     */
    public Object value() {
        return value;
    }

    /**
     * Returns whether this is the NULL literal.
     *
     * @return true if the value is null
     */
    public boolean isNull() {
        return value == null;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return "'" + ((String) value).replace("'", "''") + "'";
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        return Objects.equals(value, ((Literal) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}
