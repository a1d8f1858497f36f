package com.joinhints.logical;

import com.joinhints.exception.AnalysisException;
import com.joinhints.types.StructField;
import com.joinhints.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node selecting a subset of its child's columns by name.
 */
public final class Project extends UnaryNode {

    private final List<String> columns;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param columns the names of the columns to keep, in output order
     */
    public Project(LogicalPlan child, List<String> columns) {
        super(child);
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        if (this.columns.isEmpty()) {
            throw new IllegalArgumentException("columns must not be empty");
        }
    }

    public List<String> columns() {
        return columns;
    }

    @Override
    public StructType inferSchema() {
        StructType childSchema = child().schema();
        List<StructField> fields = new ArrayList<>(columns.size());
        for (String column : columns) {
            StructField field = childSchema.fieldByName(column);
            if (field == null) {
                throw new AnalysisException("Column '" + column + "' does not exist in " + childSchema, this);
            }
            fields.add(field);
        }
        return new StructType(fields);
    }

    @Override
    public Project withNewChild(LogicalPlan newChild) {
        return new Project(newChild, columns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Project)) return false;
        Project that = (Project) o;
        return columns.equals(that.columns) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, child());
    }

    @Override
    public String toString() {
        return String.format("Project(%s)", String.join(", ", columns));
    }
}
