package com.anthem.rxadj.dur;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Professional judgment recorded against a fired alert. The alert itself is kept.
 */
@Value
@Builder
public class DurOverride {

    DurAlertType alertType;
    String reasonForService;
    String professionalService;
    String resultOfService;

    /** Pharmacist or automated reviewer recording the override */
    String actorId;

    LocalDate overrideDate;
    String notes;
}
