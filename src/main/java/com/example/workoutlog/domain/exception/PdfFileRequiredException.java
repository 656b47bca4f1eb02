package com.example.workoutlog.domain.exception;

/**
 * Sheet extraction was requested without an uploaded file, or with an empty one.
 */
public class PdfFileRequiredException extends DomainException {

    public PdfFileRequiredException() {
        super("Please choose a filled workout sheet PDF to upload.");
    }
}
