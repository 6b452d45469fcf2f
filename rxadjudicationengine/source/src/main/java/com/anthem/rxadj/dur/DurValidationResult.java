package com.anthem.rxadj.dur;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Aggregate DUR outcome for one claim.
 */
@Value
@Builder
public class DurValidationResult {

    String claimId;

    /** No level 1 alert fired */
    boolean passed;

    @Singular
    List<DurAlert> alerts;

    int totalAlerts;
    int majorAlerts;
    int moderateAlerts;
    int minorAlerts;

    boolean requiresOverride;

    @Singular
    List<String> messages;
}
