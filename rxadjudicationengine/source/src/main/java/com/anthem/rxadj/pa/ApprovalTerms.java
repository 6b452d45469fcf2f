package com.anthem.rxadj.pa;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Overrides for an approval. Unset fields fall back to the request or configured defaults.
 */
@Value
@Builder
public class ApprovalTerms {

    Integer durationDays;
    BigDecimal quantity;
    Integer daysSupply;
    Integer refills;
    String reviewedBy;
}
