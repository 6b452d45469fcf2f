package com.anthem.rxadj.steptherapy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One step of a step therapy protocol. The step is satisfied by fills of any one of the
 * required drugs that together reach both the minimum days supply and the minimum fill count.
 */
@Value
@Builder
@Jacksonized
public class StepTherapyStep {

    int stepNumber;
    String stepName;

    /** NDCs or GPI prefixes */
    @Singular
    List<String> requiredDrugs;

    @Builder.Default
    int minimumDays = 30;

    @Builder.Default
    int minimumFills = 1;

    String description;
}
