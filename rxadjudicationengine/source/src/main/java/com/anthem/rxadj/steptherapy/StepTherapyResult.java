package com.anthem.rxadj.steptherapy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StepTherapyResult {

    String protocolId;
    boolean satisfied;

    @Singular
    List<Integer> completedSteps;

    /** First step without qualifying fills, null when satisfied */
    Integer failedStep;

    /** Drugs that would satisfy the failed step */
    @Singular
    List<String> requiredDrugs;

    String message;
}
