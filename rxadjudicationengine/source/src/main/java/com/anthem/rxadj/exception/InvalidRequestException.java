package com.anthem.rxadj.exception;

/**
 * Per-call input is missing or out of range for the rule being evaluated.
 */
public class InvalidRequestException extends RuntimeException {

    private final String field;

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
