package com.joinhints.logical;

import com.joinhints.hint.RelationIdentifiers;
import com.joinhints.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a catalog relation read by name.
 *
 * <p>The relation is identified by a multi-part name such as {@code sales.orders}; hints can
 * target it by that name or by any suffix of it.
 */
public final class TableScan extends LogicalPlan {

    private final List<String> nameParts;

    /**
     * Creates a table scan node.
     *
     * @param nameParts the qualified relation name, outermost namespace first
     * @param schema the table schema
     */
    public TableScan(List<String> nameParts, StructType schema) {
        super();
        this.nameParts = List.copyOf(Objects.requireNonNull(nameParts, "nameParts must not be null"));
        if (this.nameParts.isEmpty()) {
            throw new IllegalArgumentException("nameParts must not be empty");
        }
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /**
     * Creates a table scan node from a dotted relation name.
     *
     * @param name the relation name, e.g. {@code sales.orders}
     * @param schema the table schema
     */
    public TableScan(String name, StructType schema) {
        this(RelationIdentifiers.parse(name), schema);
    }

    /**
     * Returns the identifier hints are matched against.
     *
     * @return the name parts
     */
    public List<String> identifier() {
        return nameParts;
    }

    @Override
    public StructType inferSchema() {
        // Schema is provided at construction time
        return schema;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        requireChildCount(newChildren, 0, this);
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableScan)) return false;
        TableScan that = (TableScan) o;
        return nameParts.equals(that.nameParts) && schema.equals(that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nameParts, schema);
    }

    @Override
    public String toString() {
        return String.format("TableScan(%s)", RelationIdentifiers.quoted(nameParts));
    }
}
