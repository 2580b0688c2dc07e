package com.columnlineage.expression;

import com.columnlineage.logical.LogicalPlan;
import java.util.Collections;
import java.util.List;

/**
 * Scalar subquery expression that returns a single value.
 *
 * <p>A scalar subquery must return exactly one column.
 *
 * <p>Examples:
 * <pre>
 *   SELECT (SELECT MAX(price) FROM products) as max_price
 *   SELECT (SELECT a FROM u LIMIT 1) + 1 AS aa, b FROM t
 * </pre>
 *
 * <p>Unlike predicate subqueries, a scalar subquery in a SELECT list feeds its
 * value into the result, so its column and its tables count as lineage.
 */
public final class ScalarSubquery extends SubqueryExpression {

    /**
     * Creates a scalar subquery.
     *
     * @param subquery the subquery that returns a single value
     */
    public ScalarSubquery(LogicalPlan subquery) {
        super(subquery);
        if (subquery.output().size() != 1) {
            throw new IllegalArgumentException(
                "Scalar subquery must return exactly one column, got " + subquery.output().size());
        }
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "scalarsubquery()";
    }
}
