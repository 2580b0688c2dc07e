package com.columnlineage.exception;

import com.columnlineage.logical.LogicalPlan;

/**
 * Exception raised when lineage cannot be extracted from a plan.
 *
 * <p>This exception carries the plan node that failed, for debugging and for
 * messages that tell the user which part of the statement was at fault.
 *
 * <p>Subclasses name the specific failure:
 * <ul>
 *   <li>{@link UnresolvedPlanException} - the plan still has unresolved references</li>
 *   <li>{@link CyclicDefinitionException} - a view or cache refers back to itself</li>
 *   <li>{@link UnsupportedOperatorException} - no lineage rule for an operator (a warning only)</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   LineageResult result = extractor.extractLineage(plan);
 *   result.error().ifPresent(e -> {
 *       log.warn("{}", e.getUserMessage());
 *       log.debug("Failed plan: {}", e.getFailedPlan());
 *   });
 * </pre>
 *
 * @see com.columnlineage.lineage.LineageExtractor
 */
public class LineageException extends RuntimeException {

    private final LogicalPlan failedPlan;

    /**
     * Creates a lineage exception.
     *
     * @param message the error message
     * @param plan the plan node that failed, may be null
     */
    public LineageException(String message, LogicalPlan plan) {
        super(message + " (plan type: " + planType(plan) + ")");
        this.failedPlan = plan;
    }

    /**
     * Creates a lineage exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param plan the plan node that failed, may be null
     */
    public LineageException(String message, Throwable cause, LogicalPlan plan) {
        super(message + " (plan type: " + planType(plan) + ")", cause);
        this.failedPlan = plan;
    }

    /**
     * Returns the plan node that failed.
     *
     * @return the failed plan, or null if not available
     */
    public LogicalPlan getFailedPlan() {
        return failedPlan;
    }

    /**
     * Returns a message for end users, without plan internals.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        return "Failed to extract column lineage: " + getMessage();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Lineage Extraction Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedPlan != null) {
            sb.append("Failed Plan Type: ").append(failedPlan.getClass().getName()).append("\n");
            sb.append("Plan String: ").append(failedPlan).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    private static String planType(LogicalPlan plan) {
        return plan != null ? plan.nodeName() : "null";
    }
}
