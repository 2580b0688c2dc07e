package com.columnlineage.expression;

import com.columnlineage.logical.LogicalPlan;
import java.util.Collections;
import java.util.List;

/**
 * EXISTS subquery expression that tests for existence of rows.
 *
 * <p>Examples:
 * <pre>
 *   WHERE EXISTS (SELECT 1 FROM orders WHERE orders.customer_id = customers.id)
 *   WHERE NOT EXISTS (SELECT * FROM table1 WHERE c = 'odone')
 * </pre>
 *
 * <p>EXISTS ignores the values returned by the subquery; only whether rows
 * exist matters. It never contributes lineage.
 */
public final class ExistsSubquery extends SubqueryExpression {

    private final boolean isNegated;
    private final boolean correlated;

    /**
     * Creates an EXISTS subquery.
     *
     * @param subquery the subquery to test for existence
     * @param isNegated true for NOT EXISTS, false for EXISTS
     * @param correlated whether the subquery references columns of the outer query
     */
    public ExistsSubquery(LogicalPlan subquery, boolean isNegated, boolean correlated) {
        super(subquery);
        this.isNegated = isNegated;
        this.correlated = correlated;
    }

    /**
     * Creates an uncorrelated EXISTS subquery (not negated).
     *
     * @param subquery the subquery to test
     */
    public ExistsSubquery(LogicalPlan subquery) {
        this(subquery, false, false);
    }

    public boolean isNegated() {
        return isNegated;
    }

    public boolean isCorrelated() {
        return correlated;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return (isNegated ? "NOT " : "") + "exists(" + subquery.nodeName() + ")";
    }
}
