package com.joinhints.optimizer;

import com.joinhints.logical.LogicalPlan;

/**
 * Interface for query optimization rules.
 *
 * <p>Optimization rules transform an analyzed logical plan into an equivalent plan. Rules are
 * applied iteratively by the {@link QueryOptimizer} until no more changes occur or a maximum
 * iteration limit is reached.
 *
 * <p>Rules must preserve query semantics - the optimized plan must
 * produce the same results as the original plan.
 */
public interface OptimizationRule {

    /**
     * Applies this optimization rule to a logical plan.
     *
     * <p>Rules should be idempotent - applying the same rule multiple
     * times should not cause further changes after the first application.
     *
     * @param plan the input plan
     * @return the optimized plan (or original if no optimization applied)
     */
    LogicalPlan apply(LogicalPlan plan);

    /**
     * Returns the name of this optimization rule.
     *
     * <p>Used for logging and debugging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
