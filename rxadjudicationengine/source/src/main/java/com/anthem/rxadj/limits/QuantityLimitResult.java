package com.anthem.rxadj.limits;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of checking a requested fill against quantity limits.
 * A failed check is a normal result, not an error.
 */
@Value
@Builder(toBuilder = true)
public class QuantityLimitResult {

    boolean passed;

    /** Limit that produced this result, null when no limit applied */
    String limitId;
    QuantityLimitType limitType;

    BigDecimal requestedQuantity;
    BigDecimal allowedQuantity;
    BigDecimal maxQuantity;

    int requestedDaysSupply;
    int allowedDaysSupply;
    Integer maxDaysSupply;

    @Builder.Default
    BigDecimal quantityUsedInPeriod = BigDecimal.ZERO;
    BigDecimal quantityRemainingInPeriod;

    String message;

    /** Configuration problems noticed while evaluating, e.g. non-binding limits skipped */
    @Singular
    List<String> warnings;

    public static QuantityLimitResult unrestricted(BigDecimal requestedQuantity, int requestedDaysSupply, String message) {
        return QuantityLimitResult.builder()
                .passed(true)
                .requestedQuantity(requestedQuantity)
                .allowedQuantity(requestedQuantity)
                .requestedDaysSupply(requestedDaysSupply)
                .allowedDaysSupply(requestedDaysSupply)
                .message(message)
                .build();
    }
}
