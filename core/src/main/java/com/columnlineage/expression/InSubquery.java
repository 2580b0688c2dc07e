package com.columnlineage.expression;

import com.columnlineage.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * IN subquery expression that tests membership.
 *
 * <p>Tests whether a value (or tuple of values) appears in the result set
 * of a subquery.
 *
 * <p>Examples:
 * <pre>
 *   WHERE table0.a IN (SELECT a FROM table1)
 *   WHERE (customer_id, product_id) IN (SELECT customer_id, product_id FROM recent_orders)
 *   WHERE status NOT IN (SELECT name FROM invalid_statuses)
 * </pre>
 *
 * <p>The tested values are ordinary children. The subquery's columns never
 * flow into the result, only its row set is consulted.
 */
public final class InSubquery extends SubqueryExpression {

    private final List<Expression> values;
    private final boolean isNegated;
    private final boolean correlated;

    /**
     * Creates an IN subquery.
     *
     * @param values the tested expressions (left side of IN)
     * @param subquery the subquery providing values to test against
     * @param isNegated true for NOT IN, false for IN
     * @param correlated whether the subquery references columns of the outer query
     */
    public InSubquery(List<Expression> values, LogicalPlan subquery, boolean isNegated, boolean correlated) {
        super(subquery);
        this.values = new ArrayList<>(Objects.requireNonNull(values, "values must not be null"));
        this.isNegated = isNegated;
        this.correlated = correlated;
        if (this.values.isEmpty()) {
            throw new IllegalArgumentException("IN subquery requires at least one tested value");
        }
        if (this.values.size() != subquery.output().size()) {
            throw new IllegalArgumentException(String.format(
                "IN subquery arity mismatch: %d tested values, subquery returns %d columns",
                this.values.size(), subquery.output().size()));
        }
    }

    /**
     * Creates an uncorrelated single-value IN subquery.
     *
     * @param value the expression to test
     * @param subquery the subquery
     * @param isNegated true for NOT IN
     */
    public InSubquery(Expression value, LogicalPlan subquery, boolean isNegated) {
        this(Collections.singletonList(value), subquery, isNegated, false);
    }

    public List<Expression> values() {
        return Collections.unmodifiableList(values);
    }

    public boolean isNegated() {
        return isNegated;
    }

    public boolean isCorrelated() {
        return correlated;
    }

    @Override
    public List<Expression> children() {
        return values();
    }

    @Override
    public String toString() {
        return values + (isNegated ? " NOT IN " : " IN ") + "(" + subquery.nodeName() + ")";
    }
}
