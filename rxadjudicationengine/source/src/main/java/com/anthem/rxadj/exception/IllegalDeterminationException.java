package com.anthem.rxadj.exception;

/**
 * A determination was recorded against a prior authorization request that is unknown
 * or already in a terminal state.
 */
public class IllegalDeterminationException extends OperatorMisuseException {

    private final String paRequestId;

    public IllegalDeterminationException(String paRequestId, String message) {
        super(message);
        this.paRequestId = paRequestId;
    }

    public String getPaRequestId() {
        return paRequestId;
    }
}
