package com.example.workoutlog.domain.model;

import com.example.workoutlog.domain.exception.ExerciseNameRequiredException;

/**
 * Domain DTO pairing one printed exercise line with the text recognized inside its box.
 * Boxes are handed to the parser in top-to-bottom sheet order.
 */
public record RawBox(String exerciseName, String text) {

    /**
     * Validates the collaborator contract: a box must always belong to a named exercise.
     * A missing text is treated as an empty box.
     */
    public RawBox {
        if (exerciseName == null || exerciseName.isBlank()) {
            throw new ExerciseNameRequiredException(text);
        }
        exerciseName = exerciseName.strip();
        text = text == null ? "" : text;
    }
}
