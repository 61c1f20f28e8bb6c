package org.example.assessment.service;

/**
 * Raised synchronously to the caller of a rejected operation.
 */
public class AssessmentException extends RuntimeException {

    private final AssessmentError error;

    public AssessmentException(AssessmentError error) {
        this(error, error.getDefaultMessage());
    }

    public AssessmentException(AssessmentError error, String message) {
        super(message);
        this.error = error;
    }

    public AssessmentError getError() {
        return error;
    }

    public AssessmentError.Category getCategory() {
        return error.getCategory();
    }
}
