package com.joinhints.optimizer;

import com.joinhints.config.HintConf;
import com.joinhints.hint.HintErrorHandler;
import com.joinhints.hint.HintErrorHandlers;
import com.joinhints.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query optimizer that applies optimization rules to analyzed logical plans.
 *
 * <p>The optimizer applies rules iteratively until no more changes occur
 * or a maximum iteration limit is reached.
 *
 * <p>Example usage:
 * <pre>
 *   QueryOptimizer optimizer = new QueryOptimizer(HintConf.defaults());
 *   LogicalPlan optimized = optimizer.optimize(analyzedPlan);
 * </pre>
 *
 * <p>The optimizer includes these rules by default:
 * <ul>
 *   <li>{@link EliminateResolvedHint} - Move hints into joins</li>
 * </ul>
 */
public class QueryOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(QueryOptimizer.class);

    private static final int DEFAULT_MAX_ITERATIONS = 10;

    private final List<OptimizationRule> rules;
    private final int maxIterations;

    /**
     * Creates a query optimizer whose error handler follows the configured error mode.
     *
     * @param conf the hint configuration
     */
    public QueryOptimizer(HintConf conf) {
        this(HintErrorHandlers.forMode(conf.errorMode()));
    }

    /**
     * Creates a query optimizer with the default rules reporting to the given handler.
     *
     * @param hintErrorHandler the handler for hint problems
     */
    public QueryOptimizer(HintErrorHandler hintErrorHandler) {
        this(createDefaultRules(hintErrorHandler), DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Creates a query optimizer with custom rules and max iterations.
     *
     * @param rules the optimization rules to apply
     * @param maxIterations the maximum number of iterations
     */
    public QueryOptimizer(List<OptimizationRule> rules, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive, got: " + maxIterations);
        }
        this.rules = new ArrayList<>(rules);
        this.maxIterations = maxIterations;
    }

    /**
     * Optimizes a logical plan by applying optimization rules.
     *
     * <p>Rules are applied iteratively until no changes occur or max
     * iterations is reached. Each iteration applies all rules in order.
     *
     * @param plan the input plan
     * @return the optimized plan
     */
    public LogicalPlan optimize(LogicalPlan plan) {
        if (plan == null) {
            return null;
        }

        LogicalPlan currentPlan = plan;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            LogicalPlan previousPlan = currentPlan;

            for (OptimizationRule rule : rules) {
                LogicalPlan newPlan = rule.apply(currentPlan);
                if (newPlan != currentPlan) {
                    logger.debug("Iteration {}: rule {} changed the plan", iteration, rule.name());
                }
                currentPlan = newPlan;
            }

            if (currentPlan == previousPlan || currentPlan.equals(previousPlan)) {
                break;
            }
            if (iteration == maxIterations - 1) {
                logger.warn("Optimizer stopped after {} iterations without reaching a fixed point", maxIterations);
            }
        }

        return currentPlan;
    }

    private static List<OptimizationRule> createDefaultRules(HintErrorHandler hintErrorHandler) {
        return List.of(new EliminateResolvedHint(hintErrorHandler));
    }

    public List<OptimizationRule> rules() {
        return new ArrayList<>(rules);
    }

    public int maxIterations() {
        return maxIterations;
    }
}
