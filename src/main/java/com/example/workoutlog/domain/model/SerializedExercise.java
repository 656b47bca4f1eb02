package com.example.workoutlog.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Portable form of an {@link ExerciseRecord}, field-for-field with the storage schema.
 * Sequences are comma-joined digit strings; an empty or inapplicable sequence is {@code null},
 * never an empty string. {@code extra_text} is left out entirely when there is none.
 */
@JsonPropertyOrder({"exercise_name", "laterality", "reps_left", "reps_right", "sets",
        "weight_left", "weight_right", "extra_text"})
public record SerializedExercise(
        @JsonProperty("exercise_name") String exerciseName,
        @JsonProperty("laterality") String laterality,
        @JsonProperty("reps_left") String repsLeft,
        @JsonProperty("reps_right") String repsRight,
        @JsonProperty("sets") int sets,
        @JsonProperty("weight_left") String weightLeft,
        @JsonProperty("weight_right") String weightRight,
        @JsonProperty("extra_text") @JsonInclude(JsonInclude.Include.NON_NULL) String extraText
) {
}
