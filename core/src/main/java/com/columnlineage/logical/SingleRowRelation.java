package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import java.util.Collections;
import java.util.List;

/**
 * Leaf node producing one row with no columns.
 *
 * <p>This is the input of a SELECT without a FROM clause:
 * <pre>
 *   SELECT 1 AS one, 'x' AS name
 * </pre>
 */
public final class SingleRowRelation extends LogicalPlan {

    public SingleRowRelation() {
        super();
    }

    @Override
    public List<AttributeReference> output() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "SingleRowRelation";
    }
}
