package com.example.workoutlog.infrastructure.exception;

/**
 * Raised when exercise records cannot be written to or read from their JSON form.
 */
public class RecordSerializationException extends InfrastructureException {

    public RecordSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
