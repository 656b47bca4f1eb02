package com.example.workoutlog.domain.model;

import java.util.List;

/**
 * Structured result for one exercise box.
 * Right-side sequences are {@code null} for unilateral records. For bilateral records the two sides
 * keep their true lengths; {@code sets} is the larger of the two rep counts.
 */
public record ExerciseRecord(
        String exerciseName,
        Laterality laterality,
        int sets,
        List<Integer> weightLeft,
        List<Integer> weightRight,
        List<Integer> repsLeft,
        List<Integer> repsRight,
        String extraText
) {

    public ExerciseRecord {
        if (laterality == null) {
            throw new IllegalArgumentException("Laterality is required.");
        }
        weightLeft = weightLeft == null ? List.of() : List.copyOf(weightLeft);
        repsLeft = repsLeft == null ? List.of() : List.copyOf(repsLeft);
        if (weightLeft.size() != repsLeft.size()) {
            throw new IllegalArgumentException("Left weights and reps must have the same length.");
        }
        if (laterality == Laterality.UNILATERAL) {
            if (weightRight != null || repsRight != null) {
                throw new IllegalArgumentException("Unilateral records have no right side.");
            }
            if (sets != repsLeft.size()) {
                throw new IllegalArgumentException("Unilateral set count must equal the number of reps.");
            }
        } else {
            weightRight = weightRight == null ? List.of() : List.copyOf(weightRight);
            repsRight = repsRight == null ? List.of() : List.copyOf(repsRight);
            if (weightRight.size() != repsRight.size()) {
                throw new IllegalArgumentException("Right weights and reps must have the same length.");
            }
            if (sets != Math.max(repsLeft.size(), repsRight.size())) {
                throw new IllegalArgumentException("Bilateral set count must equal the longer side.");
            }
        }
        extraText = extraText == null || extraText.isBlank() ? null : extraText;
    }

    public static ExerciseRecord unilateral(String exerciseName, SideResult side, String extraText) {
        return new ExerciseRecord(exerciseName, Laterality.UNILATERAL, side.setCount(),
                side.weights(), null, side.reps(), null, extraText);
    }

    public static ExerciseRecord bilateral(String exerciseName, SideResult left, SideResult right, String extraText) {
        return new ExerciseRecord(exerciseName, Laterality.BILATERAL,
                Math.max(left.setCount(), right.setCount()),
                left.weights(), right.weights(), left.reps(), right.reps(), extraText);
    }

    public boolean isBilateral() {
        return laterality == Laterality.BILATERAL;
    }
}
