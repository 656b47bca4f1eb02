package com.example.workoutlog.interfaces.api.dto;

import com.example.workoutlog.domain.model.ParseWarning;
import com.example.workoutlog.domain.model.SerializedExercise;

import java.util.List;

/**
 * Parsed exercises in sheet order plus the warnings meant for human review.
 */
public record ParseResponse(List<SerializedExercise> exercises, List<ParseWarning> warnings) {
}
