package com.columnlineage.command;

import com.columnlineage.expression.Expression;
import java.util.Collections;

/**
 * {@code WHEN MATCHED THEN DELETE}. Writes no columns.
 */
public final class DeleteAction extends MergeAction {

    public DeleteAction(Expression condition) {
        super(condition, Collections.emptyList(), false);
    }

    public DeleteAction() {
        this(null);
    }
}
