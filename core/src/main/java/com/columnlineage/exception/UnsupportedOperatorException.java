package com.columnlineage.exception;

import com.columnlineage.logical.LogicalPlan;

/**
 * Records that an operator had no lineage rule and the conservative fallback
 * was applied instead.
 *
 * <p>Never thrown out of an extraction; it is reported through
 * {@link com.columnlineage.lineage.LineageResult#warnings()}.
 */
public class UnsupportedOperatorException extends LineageException {

    public UnsupportedOperatorException(LogicalPlan plan) {
        super("No lineage rule for operator " + plan.nodeName() + ", using positional fallback", plan);
    }
}
