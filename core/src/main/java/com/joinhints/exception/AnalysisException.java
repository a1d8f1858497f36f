package com.joinhints.exception;

import com.joinhints.logical.LogicalPlan;

/**
 * Exception thrown when a logical plan cannot be analyzed.
 *
 * <p>Unlike hint diagnostics, which are reported to a
 * {@link com.joinhints.hint.HintErrorHandler}, this exception signals a defect in the plan
 * itself, such as a hint parameter of an unsupported type or an unresolved hint left in a
 * plan that is supposed to be fully analyzed.
 */
public class AnalysisException extends RuntimeException {

    private final LogicalPlan failedPlan;

    /**
     * Creates an analysis exception.
     *
     * @param message the error message
     * @param plan the plan node that failed analysis
     */
    public AnalysisException(String message, LogicalPlan plan) {
        super(message + " (plan type: " + (plan != null ? plan.getClass().getSimpleName() : "null") + ")");
        this.failedPlan = plan;
    }

    /**
     * Creates an analysis exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param plan the plan node that failed analysis
     */
    public AnalysisException(String message, Throwable cause, LogicalPlan plan) {
        super(message + " (plan type: " + (plan != null ? plan.getClass().getSimpleName() : "null") + ")", cause);
        this.failedPlan = plan;
    }

    /**
     * Returns the plan node that failed analysis.
     *
     * @return the failed plan, or null if not available
     */
    public LogicalPlan getFailedPlan() {
        return failedPlan;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Analysis Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedPlan != null) {
            sb.append("Failed Plan Type: ").append(failedPlan.getClass().getName()).append("\n");
            sb.append("Plan:\n").append(failedPlan.treeString());
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
