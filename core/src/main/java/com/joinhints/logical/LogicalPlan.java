package com.joinhints.logical;

import com.joinhints.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Base class for all logical plan nodes.
 *
 * <p>This represents a node in the logical query plan tree. Each node can have zero or more
 * children and defines a schema (output columns and types). Nodes are immutable: rewrites
 * produce new nodes through {@link #withNewChildren(List)} and the {@code transform} methods,
 * which keep the original instance whenever nothing changed.
 *
 * <p>Whether a plan is fully analyzed is a structural property. {@link #resolved()} is true
 * when no node in the tree is of an unresolved variant such as {@link UnresolvedHint}; no node
 * stores a resolution flag.
 */
public abstract class LogicalPlan {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /** Output schema of this node, computed on first access */
    protected StructType schema;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    /**
     * Infers the output schema for this logical plan node.
     *
     * @return the output schema
     */
    public abstract StructType inferSchema();

    /**
     * Returns a copy of this node with its children replaced.
     *
     * @param newChildren the new children, in the same order and count as {@link #children()}
     * @return the new node
     * @throws IllegalArgumentException if the number of children does not match
     */
    public abstract LogicalPlan withNewChildren(List<LogicalPlan> newChildren);

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return children;
    }

    /**
     * Returns the output schema of this plan node.
     *
     * <p>If the schema hasn't been computed yet, this calls {@link #inferSchema()}
     * to compute it.
     *
     * @return the output schema
     */
    public StructType schema() {
        if (schema == null) {
            schema = inferSchema();
        }
        return schema;
    }

    /**
     * Returns whether this subtree is fully analyzed.
     *
     * @return true if this node and all of its descendants are resolved
     */
    public boolean resolved() {
        for (LogicalPlan child : children) {
            if (!child.resolved()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the canonical form of this plan, used to compare plans for equality regardless
     * of annotations that do not change results (hints in particular).
     *
     * @return the canonical plan
     */
    public LogicalPlan canonicalize() {
        return mapChildren(LogicalPlan::canonicalize);
    }

    /**
     * Returns whether this plan and {@code other} have the same canonical form.
     *
     * @param other the plan to compare with
     * @return true if both plans compute the same result
     */
    public boolean sameResult(LogicalPlan other) {
        return canonicalize().equals(other.canonicalize());
    }

    /**
     * Applies a function to each child and rebuilds this node if any child changed.
     *
     * @param f the function to apply to the children
     * @return this node, or a copy with the new children
     */
    public LogicalPlan mapChildren(UnaryOperator<LogicalPlan> f) {
        if (children.isEmpty()) {
            return this;
        }
        List<LogicalPlan> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (LogicalPlan child : children) {
            LogicalPlan newChild = f.apply(child);
            if (newChild != child) {
                changed = true;
            }
            newChildren.add(newChild);
        }
        return changed ? withNewChildren(newChildren) : this;
    }

    /**
     * Rewrites the tree bottom-up: children first, then this node.
     *
     * @param rule the rewrite, returning its argument unchanged when it does not apply
     * @return the rewritten plan
     */
    public LogicalPlan transformUp(UnaryOperator<LogicalPlan> rule) {
        LogicalPlan afterChildren = mapChildren(child -> child.transformUp(rule));
        return rule.apply(afterChildren);
    }

    /**
     * Rewrites the tree top-down: this node first, then the children of the result.
     *
     * @param rule the rewrite, returning its argument unchanged when it does not apply
     * @return the rewritten plan
     */
    public LogicalPlan transformDown(UnaryOperator<LogicalPlan> rule) {
        LogicalPlan afterRule = rule.apply(this);
        return afterRule.mapChildren(child -> child.transformDown(rule));
    }

    /**
     * Returns whether any node in this tree satisfies the predicate.
     *
     * @param predicate the test to apply
     * @return true if some node matches
     */
    public boolean exists(Predicate<LogicalPlan> predicate) {
        if (predicate.test(this)) {
            return true;
        }
        for (LogicalPlan child : children) {
            if (child.exists(predicate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collects every node of the given type, in pre-order.
     *
     * @param type the node class
     * @param <T> the node type
     * @return the matching nodes
     */
    public <T extends LogicalPlan> List<T> collect(Class<T> type) {
        List<T> result = new ArrayList<>();
        collectInto(type, result);
        return result;
    }

    private <T extends LogicalPlan> void collectInto(Class<T> type, List<T> result) {
        if (type.isInstance(this)) {
            result.add(type.cast(this));
        }
        for (LogicalPlan child : children) {
            child.collectInto(type, result);
        }
    }

    /**
     * Returns the plan as an indented tree, one node per line.
     *
     * @return the tree representation
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, 0);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, int depth) {
        if (depth > 0) {
            sb.append("   ".repeat(depth - 1)).append("+- ");
        }
        sb.append(this).append('\n');
        for (LogicalPlan child : children) {
            child.appendTree(sb, depth + 1);
        }
    }

    protected static void requireChildCount(List<LogicalPlan> newChildren, int expected, LogicalPlan node) {
        if (newChildren.size() != expected) {
            throw new IllegalArgumentException(String.format(
                "%s expects %d children but got %d",
                node.getClass().getSimpleName(), expected, newChildren.size()));
        }
    }

    /**
     * Returns a human-readable string representation of this plan node.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
