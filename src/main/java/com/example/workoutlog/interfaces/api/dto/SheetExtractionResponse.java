package com.example.workoutlog.interfaces.api.dto;

import com.example.workoutlog.domain.model.ParseWarning;
import com.example.workoutlog.domain.model.SerializedExercise;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * API view of a read sheet.
 */
public record SheetExtractionResponse(
        @JsonProperty("file_name") String fileName,
        @JsonProperty("page_count") int pageCount,
        @JsonProperty("title") String title,
        @JsonProperty("workout_date") LocalDate workoutDate,
        @JsonProperty("exercises") List<SerializedExercise> exercises,
        @JsonProperty("warnings") List<ParseWarning> warnings
) {
}
