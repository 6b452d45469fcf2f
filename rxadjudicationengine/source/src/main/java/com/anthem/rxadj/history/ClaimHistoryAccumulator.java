package com.anthem.rxadj.history;

import com.anthem.rxadj.exception.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Sums dispensed quantity for one NDC over a trailing window of claim history.
 */
@Component
public class ClaimHistoryAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ClaimHistoryAccumulator.class);

    /**
     * Total quantity dispensed for {@code ndc} with a service date in
     * {@code [asOf - periodDays, asOf]}, both ends inclusive.
     *
     * @param history prior fills; may be empty but not null
     * @param ndc exact product code to accumulate
     * @param periodDays window length in days
     * @param asOf service date of the claim under evaluation
     * @return quantity used in the window, zero when nothing qualifies
     */
    public BigDecimal sumQuantity(List<ClaimHistoryEntry> history, String ndc, int periodDays, LocalDate asOf) {
        if (history == null) {
            throw new InvalidRequestException("claimHistory", "Claim history is required (use an empty list when the member has none)");
        }
        if (asOf == null) {
            throw new InvalidRequestException("serviceDate", "Service date is required to accumulate claim history");
        }
        if (periodDays < 0) {
            throw new InvalidRequestException("periodDays", "Accumulation period cannot be negative: " + periodDays);
        }

        LocalDate windowStart = asOf.minusDays(periodDays);
        BigDecimal used = BigDecimal.ZERO;

        for (ClaimHistoryEntry entry : history) {
            if (entry == null || ndc == null || !ndc.equals(entry.getNdc())) {
                continue;
            }
            LocalDate serviceDate = entry.getServiceDate();
            if (serviceDate == null || serviceDate.isBefore(windowStart) || serviceDate.isAfter(asOf)) {
                continue;
            }
            if (entry.getQuantityDispensed() != null) {
                used = used.add(entry.getQuantityDispensed());
            }
        }

        log.debug("Accumulated quantity: ndc={}, window={}..{}, used={}", ndc, windowStart, asOf, used);
        return used;
    }
}
