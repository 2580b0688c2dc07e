package com.columnlineage.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a column reference the resolver could not bind.
 *
 * <p>A plan that still contains one of these is not a resolved plan; lineage
 * extraction refuses it instead of guessing what the name was meant to point to.
 */
public final class UnresolvedColumn implements Expression {

    private final String columnName;
    private final String qualifier; // Optional table/alias qualifier

    /**
     * Creates an unresolved column reference with a qualifier.
     *
     * @param columnName the column name
     * @param qualifier the table or alias qualifier (may be null)
     */
    public UnresolvedColumn(String columnName, String qualifier) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.qualifier = qualifier;
    }

    /**
     * Creates a simple unresolved column reference without a qualifier.
     *
     * @param columnName the column name
     */
    public UnresolvedColumn(String columnName) {
        this(columnName, null);
    }

    public String columnName() {
        return columnName;
    }

    public String qualifier() {
        return qualifier;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "'" + (qualifier != null ? qualifier + "." + columnName : columnName);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnresolvedColumn)) return false;
        UnresolvedColumn that = (UnresolvedColumn) obj;
        return columnName.equals(that.columnName) && Objects.equals(qualifier, that.qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, qualifier);
    }
}
