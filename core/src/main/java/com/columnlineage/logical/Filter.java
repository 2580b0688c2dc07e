package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a filter (WHERE or HAVING clause).
 *
 * <p>The condition may embed correlated {@code EXISTS} / {@code IN}
 * subqueries. Rows pass through unchanged, so the output is the child's.
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    public Filter(LogicalPlan child, Expression condition) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public Expression condition() {
        return condition;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return Collections.singletonList(condition);
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", condition);
    }
}
