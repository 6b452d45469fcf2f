package com.anthem.rxadj.dur;

/**
 * Clinical significance of a DUR alert. Level 1 is the most severe.
 */
public enum ClinicalSignificance {
    LEVEL_1("1", "MAJOR"),
    LEVEL_2("2", "MODERATE"),
    LEVEL_3("3", "MINOR");

    private final String code;
    private final String label;

    ClinicalSignificance(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public boolean isMajor() {
        return this == LEVEL_1;
    }
}
