package com.joinhints.logical;

import com.joinhints.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a relation with a user-provided alias.
 *
 * <p>The alias opens a new naming scope: a hint can target the aliased relation by its alias,
 * but relation names inside the child are not visible to hints written outside it.
 *
 * <p>Example:
 * <pre>
 *   SELECT /*+ BROADCAST(d1) *&#47; ... FROM date_dim d1 JOIN date_dim d2 ...
 * </pre>
 */
public final class AliasedRelation extends UnaryNode {

    private final String alias;

    /**
     * Creates an aliased relation.
     *
     * @param child the underlying relation
     * @param alias the user-provided alias
     */
    public AliasedRelation(LogicalPlan child, String alias) {
        super(child);
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        if (alias.isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
    }

    public String alias() {
        return alias;
    }

    /**
     * Returns the identifier hints are matched against.
     *
     * @return the alias as a single-part name
     */
    public List<String> identifier() {
        return List.of(alias);
    }

    @Override
    public StructType inferSchema() {
        return child().schema();
    }

    @Override
    public AliasedRelation withNewChild(LogicalPlan newChild) {
        return new AliasedRelation(newChild, alias);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AliasedRelation)) return false;
        AliasedRelation that = (AliasedRelation) o;
        return alias.equals(that.alias) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, child());
    }

    @Override
    public String toString() {
        return String.format("AliasedRelation[%s]", alias);
    }
}
