package com.example.workoutlog.domain.model;

import java.util.List;

/**
 * Record produced for a single box together with the warnings raised while reading it.
 */
public record BoxParseResult(ExerciseRecord record, List<ParseWarning> warnings) {

    public BoxParseResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
