package com.joinhints.logical;

import com.joinhints.types.StructType;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node for EXCEPT operations.
 *
 * <p>Returns rows of the left relation that do not appear in the right relation. The result never
 * holds more rows than the left input, so hints on the left input keep their meaning for a join
 * above this node.
 */
public final class Except extends LogicalPlan {

    private final LogicalPlan left;
    private final LogicalPlan right;
    private final boolean distinct;

    public Except(LogicalPlan left, LogicalPlan right, boolean distinct) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.left = left;
        this.right = right;
        this.distinct = distinct;
    }

    public LogicalPlan left() {
        return left;
    }

    public LogicalPlan right() {
        return right;
    }

    public boolean distinct() {
        return distinct;
    }

    public Except withLeft(LogicalPlan newLeft) {
        return new Except(newLeft, right, distinct);
    }

    @Override
    public StructType inferSchema() {
        // EXCEPT uses the schema from the left side
        return left.schema();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        requireChildCount(newChildren, 2, this);
        return new Except(newChildren.get(0), newChildren.get(1), distinct);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Except)) return false;
        Except that = (Except) o;
        return distinct == that.distinct && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, distinct);
    }

    @Override
    public String toString() {
        return "Except[distinct=" + distinct + "]";
    }
}
