package com.anthem.rxadj.pa;

public enum PriorAuthDenialReason {
    CRITERIA_NOT_MET("Clinical criteria not met"),
    STEP_THERAPY_REQUIRED("Step therapy required"),
    ALTERNATIVE_AVAILABLE("Formulary alternative available"),
    QUANTITY_EXCEEDS_LIMIT("Requested quantity exceeds limit"),
    NOT_MEDICALLY_NECESSARY("Not medically necessary"),
    DOCUMENTATION_INSUFFICIENT("Insufficient documentation"),
    DIAGNOSIS_NOT_COVERED("Diagnosis not covered");

    private final String description;

    PriorAuthDenialReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
