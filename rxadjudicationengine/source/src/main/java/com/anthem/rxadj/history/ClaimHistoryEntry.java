package com.anthem.rxadj.history;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A prior paid fill for the member, supplied by the caller per evaluation.
 */
@Value
@Builder
public class ClaimHistoryEntry {

    String ndc;
    String gpi;
    String drugName;
    LocalDate serviceDate;
    BigDecimal quantityDispensed;
    int daysSupply;
}
