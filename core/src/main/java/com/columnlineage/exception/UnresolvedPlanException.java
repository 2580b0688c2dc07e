package com.columnlineage.exception;

import com.columnlineage.expression.UnresolvedColumn;
import com.columnlineage.logical.LogicalPlan;
import java.util.Objects;

/**
 * Thrown when a plan still contains a reference the resolver could not bind.
 *
 * <p>Lineage is only defined over fully resolved plans, so extraction stops
 * rather than guessing.
 */
public class UnresolvedPlanException extends LineageException {

    private final UnresolvedColumn column;

    public UnresolvedPlanException(UnresolvedColumn column, LogicalPlan plan) {
        super("Unresolved column reference: " + Objects.requireNonNull(column, "column must not be null"), plan);
        this.column = column;
    }

    /**
     * Returns the first unresolved reference found.
     *
     * @return the unresolved column
     */
    public UnresolvedColumn getColumn() {
        return column;
    }
}
