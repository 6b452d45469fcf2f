package com.anthem.rxadj.adjudication;

import com.anthem.rxadj.dur.DurAlertSummary;
import com.anthem.rxadj.dur.DurValidationResult;
import com.anthem.rxadj.limits.QuantityLimitResult;
import com.anthem.rxadj.pa.PriorAuthResponse;
import com.anthem.rxadj.steptherapy.StepTherapyResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AdjudicationResult {

    String claimId;
    AdjudicationDecision decision;
    QuantityLimitResult quantityResult;
    DurValidationResult durResult;
    DurAlertSummary durSummary;
    boolean priorAuthRequired;

    /** Criteria set governing the drug, when one does */
    String criteriaSetId;

    PriorAuthResponse existingAuthorization;

    /** Present when a step therapy protocol governs the drug */
    StepTherapyResult stepTherapyResult;
    boolean stepTherapyRequired;

    @Singular
    List<String> messages;
}
