package com.joinhints.logical;

import com.joinhints.types.StructType;
import java.util.Objects;

/**
 * Logical plan node that keeps at most {@code limit} rows of its child.
 */
public final class Limit extends UnaryNode {

    private final long limit;

    /**
     * Creates a limit node.
     *
     * @param child the child node
     * @param limit the maximum number of rows, non-negative
     */
    public Limit(LogicalPlan child, long limit) {
        super(child);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative, got: " + limit);
        }
        this.limit = limit;
    }

    public long limit() {
        return limit;
    }

    @Override
    public StructType inferSchema() {
        return child().schema();
    }

    @Override
    public Limit withNewChild(LogicalPlan newChild) {
        return new Limit(newChild, limit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Limit)) return false;
        Limit that = (Limit) o;
        return limit == that.limit && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(limit, child());
    }

    @Override
    public String toString() {
        return String.format("Limit(%d)", limit);
    }
}
