package com.anthem.rxadj.exception;

/**
 * The API was called incorrectly (as opposed to the claim being unsafe).
 */
public class OperatorMisuseException extends RuntimeException {

    public OperatorMisuseException(String message) {
        super(message);
    }
}
