package com.columnlineage.command;

import com.columnlineage.expression.Expression;
import java.util.Collections;
import java.util.List;

/**
 * {@code WHEN MATCHED THEN UPDATE SET ...}.
 */
public final class UpdateAction extends MergeAction {

    public UpdateAction(Expression condition, List<Assignment> assignments) {
        super(condition, assignments, false);
    }

    private UpdateAction(Expression condition) {
        super(condition, Collections.emptyList(), true);
    }

    /**
     * Creates {@code UPDATE SET *}.
     *
     * @param condition the clause condition, may be null
     * @return the action
     */
    public static UpdateAction star(Expression condition) {
        return new UpdateAction(condition);
    }
}
