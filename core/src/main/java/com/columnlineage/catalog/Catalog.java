package com.columnlineage.catalog;

import com.columnlineage.logical.LogicalPlan;
import java.util.Optional;

/**
 * Read-only view of the host's catalog.
 *
 * <p>Lineage extraction only ever asks two questions: what a name canonically
 * is, and whether the name is a view with a defining plan.
 */
public interface Catalog {

    /**
     * Returns the defining plan of a view.
     *
     * @param name the canonical name
     * @return the resolved defining plan, or empty if the name is a base table
     */
    Optional<LogicalPlan> resolveDefiningPlan(QualifiedName name);

    /**
     * Resolves an identifier to its canonical name, filling in the default
     * database and ignoring case.
     *
     * @param identifier the identifier as written
     * @return the canonical name
     */
    QualifiedName canonicalName(String identifier);
}
