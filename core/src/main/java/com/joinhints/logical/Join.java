package com.joinhints.logical;

import com.joinhints.hint.JoinHint;
import com.joinhints.types.StructType;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a join operation.
 *
 * <p>This node joins two relations on a list of equally named columns ({@code USING}) or, for
 * CROSS joins, on nothing. It also carries the {@link JoinHint} collected from the hints on its
 * two inputs; the hint starts out as {@link JoinHint#NONE} and is filled in by
 * {@link com.joinhints.optimizer.EliminateResolvedHint}.
 *
 * <p>Supported join types:
 * <ul>
 *   <li>INNER - Standard inner join</li>
 *   <li>LEFT - Left outer join</li>
 *   <li>RIGHT - Right outer join</li>
 *   <li>FULL - Full outer join</li>
 *   <li>CROSS - Cartesian product (no join columns)</li>
 *   <li>LEFT_SEMI - Left semi join (returns left rows with matches)</li>
 *   <li>LEFT_ANTI - Left anti join (returns left rows without matches)</li>
 * </ul>
 */
public final class Join extends LogicalPlan {

    private final LogicalPlan left;
    private final LogicalPlan right;
    private final JoinType joinType;
    private final List<String> usingColumns;
    private final JoinHint hint;

    /**
     * Creates a join node.
     *
     * @param left the left relation
     * @param right the right relation
     * @param joinType the join type
     * @param usingColumns the join columns, empty for CROSS join
     * @param hint the strategy hints of the two inputs
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, List<String> usingColumns, JoinHint hint) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.left = left;
        this.right = right;
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.usingColumns = List.copyOf(Objects.requireNonNull(usingColumns, "usingColumns must not be null"));
        this.hint = Objects.requireNonNull(hint, "hint must not be null");

        if (joinType != JoinType.CROSS && this.usingColumns.isEmpty()) {
            throw new IllegalArgumentException("join columns are required for non-CROSS joins");
        }
        if (joinType == JoinType.CROSS && !this.usingColumns.isEmpty()) {
            throw new IllegalArgumentException("join columns must be empty for CROSS join");
        }
    }

    /**
     * Creates an unhinted join node.
     *
     * @param left the left relation
     * @param right the right relation
     * @param joinType the join type
     * @param usingColumns the join columns, empty for CROSS join
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, List<String> usingColumns) {
        this(left, right, joinType, usingColumns, JoinHint.NONE);
    }

    public LogicalPlan left() {
        return left;
    }

    public LogicalPlan right() {
        return right;
    }

    public JoinType joinType() {
        return joinType;
    }

    public List<String> usingColumns() {
        return usingColumns;
    }

    public JoinHint hint() {
        return hint;
    }

    /**
     * Returns a copy of this join with new inputs and hint.
     *
     * @param newLeft the left relation
     * @param newRight the right relation
     * @param newHint the hint
     * @return the new join
     */
    public Join copy(LogicalPlan newLeft, LogicalPlan newRight, JoinHint newHint) {
        return new Join(newLeft, newRight, joinType, usingColumns, newHint);
    }

    @Override
    public StructType inferSchema() {
        StructType leftSchema = left.schema();

        // For semi/anti joins, only include left schema
        if (joinType == JoinType.LEFT_SEMI || joinType == JoinType.LEFT_ANTI) {
            return leftSchema;
        }
        return leftSchema.merge(right.schema());
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        requireChildCount(newChildren, 2, this);
        return copy(newChildren.get(0), newChildren.get(1), hint);
    }

    /**
     * The canonical join carries no hint: hints never change the result of a join.
     */
    @Override
    public LogicalPlan canonicalize() {
        return copy(left.canonicalize(), right.canonicalize(), JoinHint.NONE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Join)) return false;
        Join that = (Join) o;
        return joinType == that.joinType
            && usingColumns.equals(that.usingColumns)
            && hint.equals(that.hint)
            && left.equals(that.left)
            && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, joinType, usingColumns, hint);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Join(").append(joinType);
        if (!usingColumns.isEmpty()) {
            sb.append(", using=").append(usingColumns);
        }
        if (!hint.equals(JoinHint.NONE)) {
            sb.append(", ").append(hint);
        }
        return sb.append(')').toString();
    }

    /**
     * Supported join types.
     */
    public enum JoinType {
        INNER,
        LEFT,
        RIGHT,
        FULL,
        CROSS,
        LEFT_SEMI,
        LEFT_ANTI
    }
}
