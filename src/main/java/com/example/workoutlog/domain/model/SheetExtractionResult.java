package com.example.workoutlog.domain.model;

/**
 * Outcome of reading a filled workout sheet PDF.
 */
public record SheetExtractionResult(
        String fileName,
        int pageCount,
        SheetTitle title,
        ParseReport report
) {
}
