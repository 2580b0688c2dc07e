package com.columnlineage.command;

import com.columnlineage.expression.Expression;
import java.util.Collections;
import java.util.List;

/**
 * {@code WHEN NOT MATCHED THEN INSERT ...}.
 */
public final class InsertAction extends MergeAction {

    public InsertAction(Expression condition, List<Assignment> assignments) {
        super(condition, assignments, false);
    }

    private InsertAction(Expression condition) {
        super(condition, Collections.emptyList(), true);
    }

    /**
     * Creates {@code INSERT *}.
     *
     * @param condition the clause condition, may be null
     * @return the action
     */
    public static InsertAction star(Expression condition) {
        return new InsertAction(condition);
    }
}
