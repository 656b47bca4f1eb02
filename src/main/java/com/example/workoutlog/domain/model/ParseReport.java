package com.example.workoutlog.domain.model;

import java.util.List;

/**
 * Ordered records for a whole sheet plus the side channel of warnings for human review.
 */
public record ParseReport(List<ExerciseRecord> records, List<ParseWarning> warnings) {

    public ParseReport {
        records = records == null ? List.of() : List.copyOf(records);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
