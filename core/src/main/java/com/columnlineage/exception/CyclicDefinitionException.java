package com.columnlineage.exception;

import com.columnlineage.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when inlining a view or cached relation reaches a definition that is
 * already being inlined, such as a view that reads itself through a cache.
 */
public class CyclicDefinitionException extends LineageException {

    private final List<String> expansionPath;

    /**
     * Creates the exception.
     *
     * @param expansionPath the definitions being inlined, outermost first,
     *                      ending with the one seen again
     * @param plan the leaf that closed the cycle
     */
    public CyclicDefinitionException(List<String> expansionPath, LogicalPlan plan) {
        super("Cyclic definition: " + String.join(" -> ", expansionPath), plan);
        this.expansionPath = Collections.unmodifiableList(new ArrayList<>(expansionPath));
    }

    public List<String> getExpansionPath() {
        return expansionPath;
    }
}
