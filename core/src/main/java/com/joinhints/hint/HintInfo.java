package com.joinhints.hint;

import java.util.Objects;
import java.util.Optional;

/**
 * The hint attributes applied to a specific plan node.
 *
 * <p>Currently a hint carries at most one preferred join strategy. Instances are immutable;
 * equality is defined by the strategy.
 */
public final class HintInfo {

    private static final HintInfo EMPTY = new HintInfo(Optional.empty());

    private final Optional<JoinStrategyHint> strategy;

    private HintInfo(Optional<JoinStrategyHint> strategy) {
        this.strategy = strategy;
    }

    /**
     * Returns a hint with no strategy.
     *
     * @return the empty hint
     */
    public static HintInfo empty() {
        return EMPTY;
    }

    /**
     * Returns a hint preferring the given strategy.
     *
     * @param strategy the preferred strategy
     * @return the hint
     */
    public static HintInfo of(JoinStrategyHint strategy) {
        return new HintInfo(Optional.of(Objects.requireNonNull(strategy, "strategy must not be null")));
    }

    /**
     * Returns a hint holding the given optional strategy.
     *
     * @param strategy the preferred strategy, possibly empty
     * @return the hint
     */
    public static HintInfo of(Optional<JoinStrategyHint> strategy) {
        return strategy.map(HintInfo::of).orElse(EMPTY);
    }

    public Optional<JoinStrategyHint> strategy() {
        return strategy;
    }

    /**
     * Combines this hint with another one.
     *
     * <p>The result holds the strategy of this hint if defined, otherwise the strategy of
     * {@code other}. When both define a strategy and the two differ, {@code other} is discarded
     * and reported through {@link HintErrorHandler#hintOverridden(HintInfo)}.
     *
     * <p>The operation is left-biased: callers that need a particular precedence must pass the
     * winning hint as the receiver.
     *
     * @param other the other hint
     * @param hintErrorHandler the handler to notify if {@code other} is overridden
     * @return the combined hint
     */
    public HintInfo merge(HintInfo other, HintErrorHandler hintErrorHandler) {
        Objects.requireNonNull(other, "other must not be null");
        Objects.requireNonNull(hintErrorHandler, "hintErrorHandler must not be null");

        if (strategy.isPresent() && other.strategy.isPresent()
                && strategy.get() != other.strategy.get()) {
            hintErrorHandler.hintOverridden(other);
        }
        return strategy.isPresent() ? this : other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HintInfo)) return false;
        return strategy.equals(((HintInfo) o).strategy);
    }

    @Override
    public int hashCode() {
        return strategy.hashCode();
    }

    @Override
    public String toString() {
        return strategy.map(s -> "(strategy=" + s + ")").orElse("none");
    }
}
