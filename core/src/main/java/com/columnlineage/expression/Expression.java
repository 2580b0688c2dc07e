package com.columnlineage.expression;

import java.util.List;

/**
 * Base interface for all expressions of a resolved plan.
 *
 * <p>Expressions represent computations that produce values, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Column references</li>
 *   <li>Arithmetic operations (a + b, a * b)</li>
 *   <li>Function calls (upper(name), hash(value))</li>
 *   <li>Aggregate and window calls</li>
 *   <li>Subqueries embedded in a SELECT list or a predicate</li>
 * </ul>
 *
 * <p>Lineage only cares about the shape of the tree: which column references
 * sit below a given node. Every expression therefore exposes its direct
 * children; subquery plans are not children, they are reached through
 * {@link SubqueryExpression#subquery()}.
 *
 * <p>All concrete implementations are immutable.
 */
public interface Expression {

    /**
     * Returns the direct child expressions, in evaluation order.
     *
     * @return an unmodifiable list of children (empty for leaves)
     */
    List<Expression> children();

    /**
     * Returns a human-readable rendering, close to the SQL text the
     * expression was resolved from.
     *
     * @return a string representation
     */
    @Override
    String toString();
}
