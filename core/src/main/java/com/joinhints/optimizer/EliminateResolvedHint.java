package com.joinhints.optimizer;

import com.joinhints.hint.HintErrorHandler;
import com.joinhints.hint.HintInfo;
import com.joinhints.hint.JoinHint;
import com.joinhints.logical.Except;
import com.joinhints.logical.Intersect;
import com.joinhints.logical.Join;
import com.joinhints.logical.LogicalPlan;
import com.joinhints.logical.ResolvedHint;
import com.joinhints.logical.UnaryNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Moves resolved hints into the joins they apply to and removes all {@link ResolvedHint} nodes.
 *
 * <p>For every join without a hint, the hints found on each input are pulled out of the input
 * and combined into the join's {@link JoinHint}:
 * <pre>
 *   Join(INNER, using=[id])                       Join(INNER, using=[id], leftHint=(strategy=broadcast))
 *   :- ResolvedHint (strategy=broadcast)     →    :- Project(id)
 *   :  +- Project(id)                             :  +- TableScan(a)
 *   :     +- TableScan(a)                         +- TableScan(b)
 *   +- TableScan(b)
 * </pre>
 *
 * <p>Hints are searched through single-child nodes and through the left input of a distinct
 * {@link Intersect} or {@link Except}, which return no more rows than their left input; the ALL
 * forms stop the search. When an input carries several hints they are merged outermost first, so the outermost hint wins
 * and the others are reported as overridden.
 *
 * <p>A resolved hint that reaches no join is reported through
 * {@link HintErrorHandler#joinNotFoundForJoinHint(HintInfo)} and removed.
 */
public final class EliminateResolvedHint implements OptimizationRule {

    private final HintErrorHandler hintErrorHandler;

    public EliminateResolvedHint(HintErrorHandler hintErrorHandler) {
        this.hintErrorHandler = Objects.requireNonNull(hintErrorHandler, "hintErrorHandler must not be null");
    }

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        LogicalPlan pulledUp = plan.transformUp(node -> {
            if (node instanceof Join join && join.hint().equals(JoinHint.NONE)) {
                return pullHintsIntoJoin(join);
            }
            return node;
        });

        return pulledUp.transformUp(node -> {
            if (node instanceof ResolvedHint hint) {
                hintErrorHandler.joinNotFoundForJoinHint(hint.hints());
                return hint.child();
            }
            return node;
        });
    }

    private LogicalPlan pullHintsIntoJoin(Join join) {
        Extracted left = extractHintsFromPlan(join.left());
        Extracted right = extractHintsFromPlan(join.right());
        if (left.hints().isEmpty() && right.hints().isEmpty()) {
            return join;
        }
        JoinHint newHint = JoinHint.of(mergeHints(left.hints()), mergeHints(right.hints()));
        return join.copy(left.plan(), right.plan(), newHint);
    }

    private HintInfo mergeHints(List<HintInfo> hints) {
        return hints.stream()
            .reduce((h1, h2) -> h1.merge(h2, hintErrorHandler))
            .orElse(null);
    }

    /**
     * Strips the hints reachable from the top of {@code plan}.
     *
     * @param plan a join input
     * @return the input without those hints, and the hints, outermost first
     */
    static Extracted extractHintsFromPlan(LogicalPlan plan) {
        if (plan instanceof ResolvedHint hint) {
            Extracted inner = extractHintsFromPlan(hint.child());
            List<HintInfo> hints = new ArrayList<>(inner.hints().size() + 1);
            hints.add(hint.hints());
            hints.addAll(inner.hints());
            return new Extracted(inner.plan(), hints);
        }
        if (plan instanceof UnaryNode unary) {
            Extracted inner = extractHintsFromPlan(unary.child());
            LogicalPlan rebuilt = inner.plan() == unary.child() ? unary : unary.withNewChild(inner.plan());
            return new Extracted(rebuilt, inner.hints());
        }
        // TODO: propagate through the left input of a LEFT_SEMI or LEFT_ANTI join as well
        if (plan instanceof Intersect intersect && intersect.distinct()) {
            Extracted inner = extractHintsFromPlan(intersect.left());
            LogicalPlan rebuilt = inner.plan() == intersect.left() ? intersect : intersect.withLeft(inner.plan());
            return new Extracted(rebuilt, inner.hints());
        }
        if (plan instanceof Except except && except.distinct()) {
            Extracted inner = extractHintsFromPlan(except.left());
            LogicalPlan rebuilt = inner.plan() == except.left() ? except : except.withLeft(inner.plan());
            return new Extracted(rebuilt, inner.hints());
        }
        return new Extracted(plan, List.of());
    }

    record Extracted(LogicalPlan plan, List<HintInfo> hints) {}
}
