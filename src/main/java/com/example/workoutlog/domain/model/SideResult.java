package com.example.workoutlog.domain.model;

import java.util.List;

/**
 * Parse output for one anatomical side of an exercise box.
 * {@code weights} and {@code reps} are index-aligned, one entry per set.
 *
 * @param weights load of each set in order of appearance
 * @param reps    repetitions of each set in order of appearance
 * @param residue text that could not be interpreted, or {@code null}
 */
public record SideResult(List<Integer> weights, List<Integer> reps, String residue) {

    public SideResult {
        weights = weights == null ? List.of() : List.copyOf(weights);
        reps = reps == null ? List.of() : List.copyOf(reps);
        if (weights.size() != reps.size()) {
            throw new IllegalArgumentException(
                    "Weights and reps must have the same length: " + weights.size() + " != " + reps.size());
        }
        residue = residue == null || residue.isBlank() ? null : residue;
    }

    /**
     * Builds a side result from the ordered sets found on that side.
     *
     * @param sets    performed sets in order of appearance
     * @param residue leftover text (may be {@code null})
     * @return side result with aligned sequences
     */
    public static SideResult of(List<WeightRepPair> sets, String residue) {
        return new SideResult(
                sets.stream().map(WeightRepPair::weight).toList(),
                sets.stream().map(WeightRepPair::reps).toList(),
                residue
        );
    }

    public int setCount() {
        return reps.size();
    }
}
