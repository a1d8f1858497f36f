package com.joinhints.analysis;

import com.joinhints.hint.HintErrorHandler;
import com.joinhints.logical.LogicalPlan;
import com.joinhints.logical.UnresolvedHint;
import java.util.Objects;

/**
 * Removes the hints no earlier rule could resolve, reporting each one as unrecognized.
 *
 * <p>This runs last in the hint analysis batch, so an {@link UnresolvedHint} reaching it has a
 * name no resolution rule knows. Its child stays in the plan, unhinted.
 */
public final class RemoveAllHints implements AnalyzerRule {

    private final HintErrorHandler hintErrorHandler;

    public RemoveAllHints(HintErrorHandler hintErrorHandler) {
        this.hintErrorHandler = Objects.requireNonNull(hintErrorHandler, "hintErrorHandler must not be null");
    }

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> {
            if (node instanceof UnresolvedHint) {
                UnresolvedHint hint = (UnresolvedHint) node;
                hintErrorHandler.hintNotRecognized(hint.name(), hint.parameters());
                return hint.child();
            }
            return node;
        });
    }
}
