package com.anthem.rxadj.exception;

import java.util.List;

/**
 * Raised when a rule table snapshot is malformed and cannot be used for evaluation.
 */
public class RuleConfigurationException extends RuntimeException {

    private final List<String> problems;

    public RuleConfigurationException(String message) {
        this(message, List.of(), null);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public RuleConfigurationException(String message, List<String> problems) {
        this(message, problems, null);
    }

    private RuleConfigurationException(String message, List<String> problems, Throwable cause) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems), cause);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
