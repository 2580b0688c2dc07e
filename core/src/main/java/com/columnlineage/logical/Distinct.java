package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node removing duplicate rows (SELECT DISTINCT).
 */
public final class Distinct extends LogicalPlan {

    public Distinct(LogicalPlan child) {
        super(Objects.requireNonNull(child, "child must not be null"));
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public String toString() {
        return "Distinct";
    }
}
