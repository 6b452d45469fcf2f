package com.anthem.rxadj.limits;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Quantity limit keyed by exact NDC or GPI class prefix.
 */
@Value
@Builder
@Jacksonized
public class QuantityLimit {

    String limitId;

    /** NDC or GPI prefix */
    String drugIdentifier;

    QuantityLimitType limitType;

    BigDecimal maxQuantity;
    Integer maxDaysSupply;

    /** Trailing window for accumulating limits */
    @Builder.Default
    int periodDays = 30;

    String description;
    String clinicalRationale;

    /**
     * A limit with neither maximum configured restricts nothing.
     */
    public boolean isBinding() {
        return maxQuantity != null || maxDaysSupply != null;
    }
}
