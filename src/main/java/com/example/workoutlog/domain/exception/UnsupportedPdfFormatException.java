package com.example.workoutlog.domain.exception;

/**
 * The upload is neither labelled {@code application/pdf} nor named {@code *.pdf}.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * @param fileName client-side file name, may be {@code null}
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super(fileName == null
                ? "Only PDF workout sheets can be read."
                : "Only PDF workout sheets can be read; '" + fileName + "' is not one.");
    }
}
