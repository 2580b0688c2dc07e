package com.columnlineage.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a resolved reference to a column.
 *
 * <p>Column references appear in:
 * <ul>
 *   <li>SELECT clauses: SELECT name, age</li>
 *   <li>WHERE clauses: WHERE age > 25</li>
 *   <li>JOIN conditions: ON t1.id = t2.id</li>
 *   <li>GROUP BY clauses: GROUP BY category</li>
 *   <li>the output list of every plan node</li>
 * </ul>
 *
 * <p>A reference is bound to a {@link ColumnId}; the name is only the display
 * name. {@link #withName(String)} renames a reference without changing what
 * it points to.
 */
public final class AttributeReference implements NamedExpression {

    private final ColumnId id;
    private final String name;

    /**
     * Creates a reference to an existing column.
     *
     * @param id the column identity
     * @param name the display name
     */
    public AttributeReference(ColumnId id, String name) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Creates a reference to a brand new column, as a leaf relation does for
     * each of its columns.
     *
     * @param name the display name
     * @return the attribute reference
     */
    public static AttributeReference newColumn(String name) {
        return new AttributeReference(ColumnId.newId(), name);
    }

    @Override
    public ColumnId id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Returns a reference to the same column under another display name.
     *
     * @param newName the new display name
     * @return the renamed reference
     */
    public AttributeReference withName(String newName) {
        return new AttributeReference(id, newName);
    }

    @Override
    public AttributeReference toAttribute() {
        return this;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return name + id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AttributeReference)) return false;
        AttributeReference that = (AttributeReference) obj;
        return id.equals(that.id) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }
}
