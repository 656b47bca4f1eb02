package com.example.workoutlog.domain.model;

/**
 * Position of one exercise line and its handwriting box on the page, in PDF points
 * (origin bottom-left, y growing upwards).
 */
public record ExerciseSlot(
        int index,
        float labelBaseline,
        float boxTop,
        float boxBottom,
        float left,
        float right
) {

    public float boxHeight() {
        return boxTop - boxBottom;
    }

    public float width() {
        return right - left;
    }
}
