package com.anthem.rxadj.pa;

public enum PriorAuthStatus {
    PENDING,
    APPROVED,
    DENIED,
    PARTIAL;

    /**
     * Terminal states are never reopened.
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}
