package com.example.workoutlog.application.parser;

import com.example.workoutlog.domain.model.WeightRepPair;

/**
 * A set found in a side's text together with where it started, used to keep sets in written order.
 *
 * @param offset        index of the set's first character in the side text
 * @param set           weight and reps; the weight is a placeholder for bare numbers
 * @param explicitWeight {@code true} when the weight was written, {@code false} when it carries forward
 */
public record PositionedSet(int offset, WeightRepPair set, boolean explicitWeight) {

    public static PositionedSet explicit(int offset, WeightRepPair set) {
        return new PositionedSet(offset, set, true);
    }

    public static PositionedSet bare(int offset, int reps) {
        return new PositionedSet(offset, new WeightRepPair(0, reps), false);
    }
}
