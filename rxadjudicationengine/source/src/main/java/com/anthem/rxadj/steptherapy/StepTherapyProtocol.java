package com.anthem.rxadj.steptherapy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Drugs that must be tried, in order, before the target drug is covered.
 */
@Value
@Builder
@Jacksonized
public class StepTherapyProtocol {

    String protocolId;
    String protocolName;

    /** NDC or GPI prefix of the target drug */
    String drugIdentifier;

    String description;

    @Singular
    List<StepTherapyStep> steps;

    /** Claim history considered, in days before the service date */
    @Builder.Default
    int lookbackDays = 365;
}
