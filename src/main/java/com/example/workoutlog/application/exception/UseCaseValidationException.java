package com.example.workoutlog.application.exception;

/**
 * A request reached an application service with input it cannot act on, e.g. an unknown laterality
 * in a reviewed record. Mapped to 400 unless a subclass has its own mapping.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message explanation returned to the client
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
