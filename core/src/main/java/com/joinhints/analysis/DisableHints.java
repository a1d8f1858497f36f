package com.joinhints.analysis;

import com.joinhints.config.HintConf;
import com.joinhints.logical.LogicalPlan;
import com.joinhints.logical.UnresolvedHint;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes every hint from the plan when hints are disabled by configuration.
 *
 * <p>Disabled hints are dropped on purpose, so nothing is reported to the hint error handler.
 */
public final class DisableHints implements AnalyzerRule {

    private static final Logger logger = LoggerFactory.getLogger(DisableHints.class);

    private final HintConf conf;

    public DisableHints(HintConf conf) {
        this.conf = Objects.requireNonNull(conf, "conf must not be null");
    }

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        if (!conf.hintsDisabled()) {
            return plan;
        }
        return plan.transformUp(node -> {
            if (node instanceof UnresolvedHint) {
                UnresolvedHint hint = (UnresolvedHint) node;
                logger.debug("Hints are disabled, ignoring {}", hint);
                return hint.child();
            }
            return node;
        });
    }
}
