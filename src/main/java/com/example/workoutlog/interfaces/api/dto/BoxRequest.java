package com.example.workoutlog.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One recognized box as sent by the OCR collaborator.
 */
public record BoxRequest(
        @JsonProperty("exercise_name") String exerciseName,
        @JsonProperty("text") String text
) {
}
