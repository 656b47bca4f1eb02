package com.example.workoutlog.application.exception;

/**
 * Thrown when a blank workout sheet cannot be laid out from the requested exercise lines.
 */
public class SheetGenerationValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public SheetGenerationValidationException(String message) {
        super(message);
    }
}
