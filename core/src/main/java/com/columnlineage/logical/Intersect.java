package com.columnlineage.logical;

import java.util.Arrays;

/**
 * Logical plan node representing INTERSECT [ALL].
 */
public final class Intersect extends SetOperation {

    public Intersect(LogicalPlan left, LogicalPlan right, boolean all) {
        super(Arrays.asList(left, right), all);
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }
}
