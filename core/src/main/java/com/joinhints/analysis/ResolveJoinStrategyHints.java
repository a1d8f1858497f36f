package com.joinhints.analysis;

import com.joinhints.config.HintConf;
import com.joinhints.exception.AnalysisException;
import com.joinhints.hint.HintErrorHandler;
import com.joinhints.hint.HintInfo;
import com.joinhints.hint.JoinStrategyHint;
import com.joinhints.hint.RelationIdentifiers;
import com.joinhints.logical.AliasedRelation;
import com.joinhints.logical.LogicalPlan;
import com.joinhints.logical.ResolvedHint;
import com.joinhints.logical.TableScan;
import com.joinhints.logical.UnresolvedHint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves join strategy hints such as {@code BROADCAST}, {@code MERGE} or
 * {@code SHUFFLE_HASH}.
 *
 * <p>Hint names are matched case-insensitively against {@link JoinStrategyHint#allHintNames()}.
 * A hint without parameters applies to the whole subtree below it:
 * <pre>
 *   UnresolvedHint BROADCAST()          ResolvedHint (strategy=broadcast)
 *   +- Project(a)                  →    +- Project(a)
 * </pre>
 *
 * <p>A hint with parameters names the relations it applies to. Each parameter is a relation
 * name, given either as a string such as {@code "sales.orders"} or as a list of name parts. The
 * subtree is searched top-down for {@link TableScan}s and {@link AliasedRelation}s whose
 * identifier ends with a hinted name, and each match is wrapped in a {@link ResolvedHint}. The
 * search does not enter aliased relations, which form their own naming scope. It does pass
 * through hints placed over a whole subtree, keeping them. If a matching relation already
 * carries a hint, the two are merged and the hint being resolved takes precedence. Hinted
 * names that match nothing are reported through {@link HintErrorHandler#hintRelationsNotFound}.
 *
 * <p>Hints with other names are left alone for later rules.
 */
public final class ResolveJoinStrategyHints implements AnalyzerRule {

    private final HintConf conf;
    private final HintErrorHandler hintErrorHandler;

    public ResolveJoinStrategyHints(HintConf conf, HintErrorHandler hintErrorHandler) {
        this.conf = Objects.requireNonNull(conf, "conf must not be null");
        this.hintErrorHandler = Objects.requireNonNull(hintErrorHandler, "hintErrorHandler must not be null");
    }

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> {
            if (node instanceof UnresolvedHint hint) {
                return JoinStrategyHint.fromName(normalize(hint.name()))
                    .map(strategy -> resolve(hint, strategy))
                    .orElse(node);
            }
            return node;
        });
    }

    private static String normalize(String hintName) {
        return hintName.toUpperCase(Locale.ROOT);
    }

    private LogicalPlan resolve(UnresolvedHint hint, JoinStrategyHint strategy) {
        HintInfo hintInfo = HintInfo.of(strategy);
        if (hint.parameters().isEmpty()) {
            // No relation named: the hint applies to the entire subtree
            return new ResolvedHint(hint.child(), hintInfo);
        }

        Set<List<String>> relationsInHint = new LinkedHashSet<>();
        for (Object parameter : hint.parameters()) {
            relationsInHint.add(toRelationName(parameter, hint));
        }

        Set<List<String>> relationsWithMatch = new HashSet<>();
        LogicalPlan applied = applyJoinStrategyHint(hint.child(), relationsInHint, relationsWithMatch, hintInfo);

        Set<List<String>> unmatched = new LinkedHashSet<>(relationsInHint);
        unmatched.removeAll(relationsWithMatch);
        if (!unmatched.isEmpty()) {
            hintErrorHandler.hintRelationsNotFound(hint.name(), hint.parameters(), Collections.unmodifiableSet(unmatched));
        }
        return applied;
    }

    private static List<String> toRelationName(Object parameter, UnresolvedHint hint) {
        if (parameter instanceof String name) {
            try {
                return RelationIdentifiers.parse(name);
            } catch (IllegalArgumentException e) {
                throw new AnalysisException(
                    "Invalid relation name '" + name + "' in hint " + hint.name(), e, hint);
            }
        }
        if (parameter instanceof List<?> parts && !parts.isEmpty()) {
            List<String> nameParts = new ArrayList<>(parts.size());
            for (Object part : parts) {
                if (!(part instanceof String)) {
                    throw unsupportedParameter(parameter, hint);
                }
                nameParts.add((String) part);
            }
            return List.copyOf(nameParts);
        }
        throw unsupportedParameter(parameter, hint);
    }

    private static AnalysisException unsupportedParameter(Object parameter, UnresolvedHint hint) {
        String type = parameter == null ? "null" : parameter.getClass().getSimpleName();
        return new AnalysisException(String.format(
            "Join strategy hint parameter should be an identifier or string but was %s (%s)",
            parameter, type), hint);
    }

    private LogicalPlan applyJoinStrategyHint(
            LogicalPlan plan,
            Set<List<String>> relationsInHint,
            Set<List<String>> relationsWithMatch,
            HintInfo hintInfo) {
        if (plan instanceof ResolvedHint existing) {
            List<String> ident = identifierOf(existing.child());
            if (ident == null) {
                // Hint over a whole subtree: its relations are still in scope
                LogicalPlan newChild = applyJoinStrategyHint(
                    existing.child(), relationsInHint, relationsWithMatch, hintInfo);
                return newChild == existing.child() ? plan : new ResolvedHint(newChild, existing.hints());
            }
            if (markMatches(ident, relationsInHint, relationsWithMatch)) {
                return new ResolvedHint(existing.child(), hintInfo.merge(existing.hints(), hintErrorHandler));
            }
            // Hinted relation with another name
            return plan;
        }

        List<String> ident = identifierOf(plan);
        if (ident != null && markMatches(ident, relationsInHint, relationsWithMatch)) {
            return new ResolvedHint(plan, hintInfo);
        }
        if (plan instanceof AliasedRelation) {
            // Different naming scope
            return plan;
        }
        return plan.mapChildren(child ->
            applyJoinStrategyHint(child, relationsInHint, relationsWithMatch, hintInfo));
    }

    private static List<String> identifierOf(LogicalPlan plan) {
        if (plan instanceof TableScan) {
            return ((TableScan) plan).identifier();
        }
        if (plan instanceof AliasedRelation) {
            return ((AliasedRelation) plan).identifier();
        }
        return null;
    }

    private boolean markMatches(
            List<String> identInQuery,
            Set<List<String>> relationsInHint,
            Set<List<String>> relationsWithMatch) {
        boolean matched = false;
        for (List<String> identInHint : relationsInHint) {
            if (RelationIdentifiers.matches(identInHint, identInQuery, conf.caseSensitive())) {
                relationsWithMatch.add(identInHint);
                matched = true;
            }
        }
        return matched;
    }
}
