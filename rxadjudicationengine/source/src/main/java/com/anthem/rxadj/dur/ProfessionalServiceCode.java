package com.anthem.rxadj.dur;

import java.util.Arrays;
import java.util.Optional;

/**
 * NCPDP professional service codes accepted on a DUR override. The set is closed.
 */
public enum ProfessionalServiceCode {
    PHARMACIST_CONSULTED("M0"),
    PHARMACIST_APPROVED("M1"),
    PRESCRIBER_CONSULTED("P0"),
    PRESCRIBER_APPROVED("R0"),
    PATIENT_CONSULTED("CC");

    private final String code;

    ProfessionalServiceCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<ProfessionalServiceCode> fromCode(String code) {
        return Arrays.stream(values()).filter(c -> c.code.equals(code)).findFirst();
    }
}
