package com.example.workoutlog.infrastructure.exception;

/**
 * Root of the failures raised by adapters around PDFBox and Jackson. Always carries the library
 * exception that caused it.
 */
public abstract class InfrastructureException extends RuntimeException {

    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
