package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a LIMIT clause.
 */
public final class Limit extends LogicalPlan {

    private final long limit;

    public Limit(LogicalPlan child, long limit) {
        super(Objects.requireNonNull(child, "child must not be null"));
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative, got " + limit);
        }
        this.limit = limit;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public long limit() {
        return limit;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public String toString() {
        return String.format("Limit(%d)", limit);
    }
}
