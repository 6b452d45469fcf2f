package com.anthem.rxadj.dur;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Safety alert produced by one DUR check.
 */
@Value
@Builder(toBuilder = true)
public class DurAlert {

    DurAlertType alertType;
    ClinicalSignificance clinicalSignificance;

    /** Rule table entry that fired, e.g. DD-001 */
    String ruleId;

    String drug1Ndc;
    String drug1Name;
    String drug1Gpi;

    String drug2Ndc;
    String drug2Name;
    String drug2Gpi;

    String message;
    String recommendation;

    String reasonForService;
    String professionalService;
    String resultOfService;

    // early refill only
    Integer daysEarly;
    LocalDate previousFillDate;

    public boolean isMajor() {
        return clinicalSignificance != null && clinicalSignificance.isMajor();
    }
}
