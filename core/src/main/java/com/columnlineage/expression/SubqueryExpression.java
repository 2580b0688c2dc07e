package com.columnlineage.expression;

import com.columnlineage.logical.LogicalPlan;
import java.util.Objects;

/**
 * An expression that embeds a resolved query plan: {@link ScalarSubquery},
 * {@link InSubquery} or {@link ExistsSubquery}.
 *
 * <p>The nested plan is not an expression child; lineage code reaches it
 * through {@link #subquery()} and decides per subquery kind whether its
 * columns and tables contribute.
 */
public abstract class SubqueryExpression implements Expression {

    protected final LogicalPlan subquery;

    protected SubqueryExpression(LogicalPlan subquery) {
        this.subquery = Objects.requireNonNull(subquery, "subquery must not be null");
    }

    /**
     * Returns the subquery plan.
     *
     * @return the subquery
     */
    public LogicalPlan subquery() {
        return subquery;
    }
}
