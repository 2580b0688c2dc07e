package com.columnlineage.logical;

import java.util.Arrays;

/**
 * Logical plan node representing EXCEPT [ALL].
 *
 * <pre>
 *   SELECT a FROM t1 EXCEPT SELECT a FROM t2
 * </pre>
 */
public final class Except extends SetOperation {

    public Except(LogicalPlan left, LogicalPlan right, boolean all) {
        super(Arrays.asList(left, right), all);
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }
}
