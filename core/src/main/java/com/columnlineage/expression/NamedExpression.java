package com.columnlineage.expression;

/**
 * An expression that produces a named output column of a plan node.
 *
 * <p>Project lists, aggregate lists and window lists are made of named
 * expressions: either a plain {@link AttributeReference} passed through, or an
 * {@link Alias} wrapping a computation.
 */
public interface NamedExpression extends Expression {

    /**
     * Returns the identity of the column this expression produces.
     *
     * @return the column id
     */
    ColumnId id();

    /**
     * Returns the display name of the produced column.
     *
     * @return the name
     */
    String name();

    /**
     * Returns a reference to the produced column, usable by parent nodes.
     *
     * @return the attribute reference
     */
    AttributeReference toAttribute();
}
