package com.joinhints.hint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Hint associated with a join node: one optional {@link HintInfo} for each of its inputs.
 *
 * @param leftHint the hint collected from the left input
 * @param rightHint the hint collected from the right input
 */
public record JoinHint(Optional<HintInfo> leftHint, Optional<HintInfo> rightHint) {

    /** No hint on either side. Use this instead of building an empty pair. */
    public static final JoinHint NONE = new JoinHint(Optional.empty(), Optional.empty());

    public JoinHint {
        Objects.requireNonNull(leftHint, "leftHint must not be null");
        Objects.requireNonNull(rightHint, "rightHint must not be null");
    }

    /**
     * Creates a join hint from nullable side hints.
     *
     * @param leftHint the left hint, or null
     * @param rightHint the right hint, or null
     * @return the join hint, {@link #NONE} when both sides are null
     */
    public static JoinHint of(HintInfo leftHint, HintInfo rightHint) {
        if (leftHint == null && rightHint == null) {
            return NONE;
        }
        return new JoinHint(Optional.ofNullable(leftHint), Optional.ofNullable(rightHint));
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>(2);
        leftHint.ifPresent(h -> parts.add("leftHint=" + h));
        rightHint.ifPresent(h -> parts.add("rightHint=" + h));
        return String.join(", ", parts);
    }
}
