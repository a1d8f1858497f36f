package com.joinhints.logical;

import java.util.List;
import java.util.Objects;

/**
 * A logical plan node with exactly one child.
 */
public abstract class UnaryNode extends LogicalPlan {

    protected UnaryNode(LogicalPlan child) {
        super(Objects.requireNonNull(child, "child must not be null"));
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns a copy of this node over a different child.
     *
     * @param newChild the new child
     * @return the new node
     */
    public abstract UnaryNode withNewChild(LogicalPlan newChild);

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        requireChildCount(newChildren, 1, this);
        return withNewChild(newChildren.get(0));
    }
}
