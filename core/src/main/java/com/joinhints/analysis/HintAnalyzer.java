package com.joinhints.analysis;

import com.joinhints.config.HintConf;
import com.joinhints.exception.AnalysisException;
import com.joinhints.hint.HintErrorHandler;
import com.joinhints.hint.HintErrorHandlers;
import com.joinhints.logical.LogicalPlan;
import com.joinhints.logical.UnresolvedHint;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the hint analysis batch over a parsed plan.
 *
 * <p>The default batch is, in order:
 * <ol>
 *   <li>{@link DisableHints} - drops all hints when disabled by configuration</li>
 *   <li>{@link ResolveJoinStrategyHints} - resolves join strategy hints</li>
 *   <li>{@link RemoveAllHints} - drops and reports the hints left unresolved</li>
 * </ol>
 *
 * <p>Example usage:
 * <pre>
 *   HintAnalyzer analyzer = new HintAnalyzer(HintConf.fromSystemProperties());
 *   LogicalPlan analyzed = analyzer.analyze(parsedPlan);
 * </pre>
 *
 * <p>Hint problems go to the {@link HintErrorHandler}; only a plan that is left with
 * unresolved hints after the batch fails analysis.
 */
public class HintAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(HintAnalyzer.class);

    private final List<AnalyzerRule> rules;

    /**
     * Creates an analyzer whose error handler follows the configured error mode.
     *
     * @param conf the hint configuration
     */
    public HintAnalyzer(HintConf conf) {
        this(conf, HintErrorHandlers.forMode(conf.errorMode()));
    }

    /**
     * Creates an analyzer reporting to the given handler.
     *
     * @param conf the hint configuration
     * @param hintErrorHandler the handler for hint problems
     */
    public HintAnalyzer(HintConf conf, HintErrorHandler hintErrorHandler) {
        this(createDefaultRules(conf, hintErrorHandler));
    }

    /**
     * Creates an analyzer with custom rules.
     *
     * @param rules the rules to apply, in order
     */
    public HintAnalyzer(List<AnalyzerRule> rules) {
        this.rules = new ArrayList<>(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /**
     * Applies every rule once, in order, and checks the result.
     *
     * @param plan the parsed plan
     * @return the analyzed plan
     * @throws AnalysisException if the plan still contains unresolved hints
     */
    public LogicalPlan analyze(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");

        LogicalPlan currentPlan = plan;
        for (AnalyzerRule rule : rules) {
            LogicalPlan newPlan = rule.apply(currentPlan);
            if (newPlan != currentPlan && logger.isDebugEnabled()) {
                logger.debug("Applied rule {}:\n{}", rule.name(), newPlan.treeString());
            }
            currentPlan = newPlan;
        }

        checkAnalysis(currentPlan);
        return currentPlan;
    }

    /**
     * Verifies that no unresolved hint is left in an analyzed plan.
     *
     * @param plan the analyzed plan
     * @throws AnalysisException naming the first unresolved hint found
     */
    public static void checkAnalysis(LogicalPlan plan) {
        if (plan.resolved()) {
            return;
        }
        List<UnresolvedHint> leftover = plan.collect(UnresolvedHint.class);
        LogicalPlan failed = leftover.isEmpty() ? plan : leftover.get(0);
        throw new AnalysisException("Plan is not fully analyzed, found " + failed, failed);
    }

    private static List<AnalyzerRule> createDefaultRules(HintConf conf, HintErrorHandler hintErrorHandler) {
        return List.of(
            new DisableHints(conf),
            new ResolveJoinStrategyHints(conf, hintErrorHandler),
            new RemoveAllHints(hintErrorHandler)
        );
    }

    public List<AnalyzerRule> rules() {
        return new ArrayList<>(rules);
    }
}
