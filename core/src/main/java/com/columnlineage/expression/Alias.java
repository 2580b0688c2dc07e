package com.columnlineage.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression that gives a name to the value of another expression.
 *
 * <p>Aliases appear in SELECT and aggregate lists:
 * <pre>
 *   SELECT key AS k                -- renames an existing column
 *   SELECT hash(col1) AS col2      -- names a computed column
 * </pre>
 *
 * <p>Renaming never changes column identity: aliasing a plain
 * {@link AttributeReference} keeps its {@link ColumnId}. Aliasing any other
 * expression produces a new column with a freshly minted id, even when the
 * same expression appears elsewhere in the plan.
 */
public final class Alias implements NamedExpression {

    private final Expression child;
    private final String name;
    private final ColumnId id;

    /**
     * Creates an alias with an explicit column id.
     *
     * @param child the aliased expression
     * @param name the alias name
     * @param id the id of the produced column
     */
    public Alias(Expression child, String name, ColumnId id) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.id = Objects.requireNonNull(id, "id must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("alias name must not be empty");
        }
    }

    /**
     * Creates an alias, inheriting the id of a plain column reference or
     * minting a new one for a computed value.
     *
     * @param child the aliased expression
     * @param name the alias name
     */
    public Alias(Expression child, String name) {
        this(child, name, child instanceof AttributeReference
            ? ((AttributeReference) child).id()
            : ColumnId.newId());
    }

    /**
     * Returns the aliased expression.
     *
     * @return the child expression
     */
    public Expression child() {
        return child;
    }

    @Override
    public ColumnId id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public AttributeReference toAttribute() {
        return new AttributeReference(id, name);
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(child);
    }

    @Override
    public String toString() {
        return child + " AS " + name + id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Alias)) return false;
        Alias that = (Alias) obj;
        return child.equals(that.child) && name.equals(that.name) && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, name, id);
    }
}
