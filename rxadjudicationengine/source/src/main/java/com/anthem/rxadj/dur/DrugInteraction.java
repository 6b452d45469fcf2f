package com.anthem.rxadj.dur;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Interaction between two therapeutic classes, keyed by GPI prefix pair.
 * The pair is unordered: either drug may be the new one.
 */
@Value
@Builder
@Jacksonized
public class DrugInteraction {

    String interactionId;
    String drug1Gpi;
    String drug2Gpi;
    String drug1Name;
    String drug2Name;
    String interactionDescription;
    String clinicalEffect;
    ClinicalSignificance clinicalSignificance;
    String recommendation;

    @Builder.Default
    String documentationLevel = "Good";
}
