package com.columnlineage.command;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.expression.AttributeReference;
import com.columnlineage.logical.LogicalPlan;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Base class for DDL/DML statements that write to a destination.
 *
 * <p>A command sits at the root of a plan. It produces no columns of its own;
 * its lineage is the lineage of its query bound onto the destination's schema.
 */
public abstract class Command extends LogicalPlan {

    protected Command() {
        super();
    }

    protected Command(LogicalPlan child) {
        super(child);
    }

    protected Command(List<LogicalPlan> children) {
        super(children);
    }

    /**
     * Returns the destination written by this command.
     *
     * @return the target name
     */
    public abstract QualifiedName target();

    /**
     * Returns the plan producing the written rows.
     *
     * @return the query, or empty for a command that writes no rows
     */
    public abstract Optional<LogicalPlan> query();

    @Override
    public List<AttributeReference> output() {
        return Collections.emptyList();
    }
}
