package com.joinhints.logical;

import com.joinhints.hint.RelationIdentifiers;
import com.joinhints.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A general hint for the child that is not yet resolved.
 *
 * <p>This node is produced by the parser, e.g. for {@code SELECT /*+ BROADCAST(t) *&#47;}, and
 * must be replaced or removed during analysis. It is never resolved, so any plan that still
 * contains one is not fully analyzed.
 */
public final class UnresolvedHint extends UnaryNode {

    private final String name;
    private final List<Object> parameters;

    /**
     * Creates an unresolved hint.
     *
     * @param name the name of the hint as written
     * @param parameters the hint parameters: relation names as {@code String} or as a
     *                   {@code List<String>} of name parts
     * @param child the plan on which this hint applies
     */
    public UnresolvedHint(String name, List<?> parameters, LogicalPlan child) {
        super(child);
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        this.parameters = Collections.unmodifiableList(new ArrayList<Object>(parameters));
    }

    public String name() {
        return name;
    }

    public List<Object> parameters() {
        return parameters;
    }

    @Override
    public boolean resolved() {
        return false;
    }

    @Override
    public StructType inferSchema() {
        return child().schema();
    }

    @Override
    public UnresolvedHint withNewChild(LogicalPlan newChild) {
        return new UnresolvedHint(name, parameters, newChild);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnresolvedHint)) return false;
        UnresolvedHint that = (UnresolvedHint) o;
        return name.equals(that.name) && parameters.equals(that.parameters) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters, child());
    }

    @Override
    public String toString() {
        return "UnresolvedHint " + RelationIdentifiers.prettyHint(name, parameters);
    }
}
