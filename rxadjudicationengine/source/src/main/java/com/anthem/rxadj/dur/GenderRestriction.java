package com.anthem.rxadj.dur;

import com.anthem.rxadj.model.Gender;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class GenderRestriction {

    String restrictionId;
    String drugGpi;
    String drugName;
    Gender allowedGender;

    @Builder.Default
    ClinicalSignificance significance = ClinicalSignificance.LEVEL_1;

    String message;
}
