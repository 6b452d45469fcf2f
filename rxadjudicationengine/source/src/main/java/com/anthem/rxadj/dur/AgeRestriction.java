package com.anthem.rxadj.dur;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AgeRestriction {

    String restrictionId;
    String drugGpi;
    String drugName;
    Integer minAge;
    Integer maxAge;

    @Builder.Default
    ClinicalSignificance significance = ClinicalSignificance.LEVEL_2;

    String message;

    public boolean excludes(int age) {
        return (minAge != null && age < minAge) || (maxAge != null && age > maxAge);
    }
}
