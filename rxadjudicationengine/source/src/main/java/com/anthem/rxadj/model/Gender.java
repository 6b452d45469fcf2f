package com.anthem.rxadj.model;

/**
 * Administrative gender as carried on pharmacy eligibility.
 */
public enum Gender {
    M,
    F,
    U;

    public static Gender fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return switch (code.trim().toUpperCase()) {
            case "M", "MALE" -> M;
            case "F", "FEMALE" -> F;
            case "U", "UNKNOWN" -> U;
            default -> throw new IllegalArgumentException("Unknown gender code: " + code);
        };
    }
}
