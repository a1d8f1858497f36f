package com.joinhints.logical;

import com.joinhints.hint.HintInfo;
import com.joinhints.types.StructType;
import java.util.Objects;

/**
 * A resolved hint node.
 *
 * <p>The analyzer converts every {@link UnresolvedHint} into a ResolvedHint or drops it. The
 * optimizer moves ResolvedHints into the joins they apply to and removes them before physical
 * planning. The node is transparent: it has its child's schema and canonical form.
 */
public final class ResolvedHint extends UnaryNode {

    private final HintInfo hints;

    /**
     * Creates a resolved hint.
     *
     * @param child the plan the hint applies to
     * @param hints the resolved hint attributes
     */
    public ResolvedHint(LogicalPlan child, HintInfo hints) {
        super(child);
        this.hints = Objects.requireNonNull(hints, "hints must not be null");
    }

    /**
     * Creates a resolved hint with no attributes.
     *
     * @param child the plan the hint applies to
     */
    public ResolvedHint(LogicalPlan child) {
        this(child, HintInfo.empty());
    }

    public HintInfo hints() {
        return hints;
    }

    @Override
    public StructType inferSchema() {
        return child().schema();
    }

    @Override
    public LogicalPlan canonicalize() {
        return child().canonicalize();
    }

    @Override
    public ResolvedHint withNewChild(LogicalPlan newChild) {
        return new ResolvedHint(newChild, hints);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedHint)) return false;
        ResolvedHint that = (ResolvedHint) o;
        return hints.equals(that.hints) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(hints, child());
    }

    @Override
    public String toString() {
        return "ResolvedHint " + hints;
    }
}
