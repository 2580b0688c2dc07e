package com.columnlineage.logical;

import java.util.Arrays;
import java.util.List;

/**
 * Logical plan node representing a UNION or UNION ALL.
 *
 * <p>A chain of unions is flattened by the optimizer into one n-ary node:
 * <pre>
 *   SELECT a, b FROM t1 UNION ALL SELECT a, b FROM t2 UNION ALL SELECT c, d FROM t3
 * </pre>
 */
public final class Union extends SetOperation {

    public Union(List<LogicalPlan> children, boolean all) {
        super(children, all);
    }

    public Union(LogicalPlan left, LogicalPlan right, boolean all) {
        this(Arrays.asList(left, right), all);
    }

    /**
     * Creates a UNION ALL.
     *
     * @param left the left relation
     * @param right the right relation
     */
    public Union(LogicalPlan left, LogicalPlan right) {
        this(left, right, true);
    }
}
