package com.anthem.rxadj.dur;

import lombok.Value;

@Value
public class OverrideValidation {

    boolean valid;
    String reason;

    public static OverrideValidation accepted() {
        return new OverrideValidation(true, "Override valid");
    }

    public static OverrideValidation rejected(String reason) {
        return new OverrideValidation(false, reason);
    }
}
