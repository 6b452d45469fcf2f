package com.anthem.rxadj.pa;

import com.anthem.rxadj.criteria.CriteriaEvaluationResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Determination on a prior authorization request. Approval fields are set for APPROVED and
 * PARTIAL, denial and appeal fields for DENIED.
 */
@Value
@Builder
public class PriorAuthResponse {

    String paRequestId;
    PriorAuthStatus status;
    LocalDateTime responseDate;

    String authorizationNumber;
    LocalDate effectiveDate;
    LocalDate expirationDate;
    BigDecimal quantityApproved;
    Integer daysSupplyApproved;
    Integer refillsApproved;

    PriorAuthDenialReason denialReason;

    /** Denial text, or the reason for modified terms on a partial approval */
    String denialMessage;

    @Builder.Default
    List<String> suggestedAlternatives = List.of();

    LocalDate appealDeadline;
    String appealInstructions;

    String reviewedBy;
    boolean autoApproved;

    /** Present when the determination came from criteria review */
    CriteriaEvaluationResult criteriaResult;

    /**
     * Whether this authorization covers the given date.
     */
    public boolean isActiveOn(LocalDate date) {
        return status == PriorAuthStatus.APPROVED
                && effectiveDate != null && expirationDate != null
                && !date.isBefore(effectiveDate) && !date.isAfter(expirationDate);
    }
}
