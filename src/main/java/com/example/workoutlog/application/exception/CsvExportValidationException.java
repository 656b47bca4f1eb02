package com.example.workoutlog.application.exception;

/**
 * Thrown when parsed records cannot be exported for the storage importer.
 */
public class CsvExportValidationException extends UseCaseValidationException {

    public CsvExportValidationException(String message) {
        super(message);
    }
}
