package com.anthem.rxadj.dur;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Alerts for a claim together with the overrides recorded against them.
 */
@Value
@Builder
public class DurAlertSummary {

    String claimId;
    int totalAlerts;
    int level1Alerts;
    int level2Alerts;
    int level3Alerts;

    @Singular
    List<DurAlert> alerts;

    boolean requiresOverride;
    boolean overrideProvided;

    @Singular
    List<String> overrideCodes;

    boolean canProceed;
    String rejectionReason;
}
