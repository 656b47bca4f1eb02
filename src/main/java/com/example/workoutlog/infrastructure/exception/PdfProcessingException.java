package com.example.workoutlog.infrastructure.exception;

/**
 * A sheet PDF could not be drawn, saved or loaded.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message what was being done with the sheet
	 * @param cause   PDFBox or IO failure
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
