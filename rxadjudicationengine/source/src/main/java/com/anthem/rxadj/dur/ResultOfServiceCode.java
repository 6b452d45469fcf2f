package com.anthem.rxadj.dur;

import java.util.Arrays;
import java.util.Optional;

/**
 * NCPDP result of service codes accepted on a DUR override. The set is closed.
 */
public enum ResultOfServiceCode {
    FILLED_AS_IS("1A"),
    FILLED_WITH_CHANGE("1B"),
    FILLED_DIFFERENT_DRUG("1C"),
    NOT_FILLED("1E"),
    PARTIALLY_FILLED("1G");

    private final String code;

    ResultOfServiceCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<ResultOfServiceCode> fromCode(String code) {
        return Arrays.stream(values()).filter(c -> c.code.equals(code)).findFirst();
    }
}
