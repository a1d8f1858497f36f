package com.joinhints.analysis;

import com.joinhints.logical.LogicalPlan;

/**
 * A rewrite applied to a logical plan during analysis.
 *
 * <p>Analyzer rules turn what the parser produced into a plan the optimizer can work with.
 * A rule returns the original plan instance when it does not apply, which lets the
 * {@link HintAnalyzer} detect and log which rules changed the plan.
 */
public interface AnalyzerRule {

    /**
     * Applies this rule to a logical plan.
     *
     * @param plan the input plan
     * @return the rewritten plan (or the original if the rule did not apply)
     */
    LogicalPlan apply(LogicalPlan plan);

    /**
     * Returns the name of this rule.
     *
     * <p>Used for logging and debugging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
