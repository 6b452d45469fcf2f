package com.anthem.rxadj.exception;

/**
 * DUR override codes outside the allowed code set or combination table.
 */
public class InvalidOverrideException extends OperatorMisuseException {

    public InvalidOverrideException(String message) {
        super(message);
    }
}
