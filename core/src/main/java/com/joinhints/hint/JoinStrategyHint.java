package com.joinhints.hint;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The closed set of join strategies a hint can ask for.
 *
 * <p>The hinted strategy is used for the join it is associated with if doable. When the two
 * sides of a join carry contradicting strategy hints, hints are prioritized as
 * {@link #BROADCAST} over {@link #SHUFFLE_MERGE} over {@link #SHUFFLE_HASH} over
 * {@link #SHUFFLE_REPLICATE_NL}; {@link #strategies()} lists them in that order.
 *
 * <p>Name resolution matches literal aliases exactly. Callers that accept hint names in any
 * case are expected to upper-case them with {@link java.util.Locale#ROOT} first.
 */
public enum JoinStrategyHint {

    /**
     * Broadcast hash join or broadcast nested loop join, depending on the availability of
     * equi-join keys.
     */
    BROADCAST("broadcast", "BROADCAST", "BROADCASTJOIN", "MAPJOIN"),

    /** Shuffle sort merge join. */
    SHUFFLE_MERGE("merge", "SHUFFLE_MERGE", "MERGE", "MERGEJOIN"),

    /** Shuffle hash join. */
    SHUFFLE_HASH("shuffle_hash", "SHUFFLE_HASH"),

    /** Shuffle-and-replicate nested loop join, a.k.a. cartesian product join. */
    SHUFFLE_REPLICATE_NL("shuffle_replicate_nl", "SHUFFLE_REPLICATE_NL"),

    /**
     * Internal hint discouraging a broadcast hash join, set by adaptive execution. It has no
     * alias and cannot be requested by name.
     */
    NO_BROADCAST_HASH("no_broadcast_hash");

    private static final Set<JoinStrategyHint> STRATEGIES = Collections.unmodifiableSet(
        EnumSet.of(BROADCAST, SHUFFLE_MERGE, SHUFFLE_HASH, SHUFFLE_REPLICATE_NL));

    private static final Map<String, JoinStrategyHint> BY_ALIAS = new HashMap<>();

    static {
        for (JoinStrategyHint strategy : STRATEGIES) {
            for (String alias : strategy.hintAliases) {
                JoinStrategyHint previous = BY_ALIAS.put(alias, strategy);
                if (previous != null) {
                    throw new IllegalStateException(
                        "Hint alias '%s' is claimed by both %s and %s".formatted(alias, previous, strategy));
                }
            }
        }
    }

    private final String displayName;
    private final Set<String> hintAliases;

    JoinStrategyHint(String displayName, String... hintAliases) {
        this.displayName = displayName;
        this.hintAliases = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(hintAliases)));
    }

    /**
     * Returns the name used for this strategy in plan output.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Returns the hint names that resolve to this strategy.
     *
     * @return an unmodifiable set of aliases, empty for internal-only strategies
     */
    public Set<String> hintAliases() {
        return hintAliases;
    }

    /**
     * Returns the strategies that can be requested by name, in priority order.
     *
     * @return the user-facing strategies
     */
    public static Set<JoinStrategyHint> strategies() {
        return STRATEGIES;
    }

    /**
     * Returns every alias accepted by {@link #fromName(String)}.
     *
     * @return an unmodifiable set of hint names
     */
    public static Set<String> allHintNames() {
        return Collections.unmodifiableSet(BY_ALIAS.keySet());
    }

    /**
     * Resolves a hint name to the strategy whose alias set contains it.
     *
     * @param name the hint name, matched exactly
     * @return the matching strategy, or empty if the name is not a join strategy hint
     */
    public static Optional<JoinStrategyHint> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ALIAS.get(name));
    }

    @Override
    public String toString() {
        return displayName;
    }
}
