package com.joinhints.logical;

import com.joinhints.types.StructType;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node for INTERSECT operations.
 *
 * <p>Returns rows that appear in both left and right relations. The result never holds more rows
 * than the left input, so hints on the left input keep their meaning for a join above this node.
 */
public final class Intersect extends LogicalPlan {

    private final LogicalPlan left;
    private final LogicalPlan right;
    private final boolean distinct;

    public Intersect(LogicalPlan left, LogicalPlan right, boolean distinct) {
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

    public Intersect withLeft(LogicalPlan newLeft) {
        return new Intersect(newLeft, right, distinct);
    }

    @Override
    public StructType inferSchema() {
        // INTERSECT uses the schema from the left side
        return left.schema();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        requireChildCount(newChildren, 2, this);
        return new Intersect(newChildren.get(0), newChildren.get(1), distinct);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Intersect)) return false;
        Intersect that = (Intersect) o;
        return distinct == that.distinct && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, distinct);
    }

    @Override
    public String toString() {
        return "Intersect[distinct=" + distinct + "]";
    }
}
