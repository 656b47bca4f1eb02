package com.example.workoutlog.interfaces.api.dto;

import com.example.workoutlog.domain.model.SerializedExercise;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Reviewed exercises to export for the storage importer.
 */
public record ExportRequest(
        @JsonProperty("workout_date") LocalDate workoutDate,
        @JsonProperty("exercises") List<SerializedExercise> exercises
) {
}
