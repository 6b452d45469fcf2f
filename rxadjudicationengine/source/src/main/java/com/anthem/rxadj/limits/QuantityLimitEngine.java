package com.anthem.rxadj.limits;

import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.exception.InvalidRequestException;
import com.anthem.rxadj.history.ClaimHistoryAccumulator;
import com.anthem.rxadj.history.ClaimHistoryEntry;
import com.anthem.rxadj.rules.RuleTables;
import com.anthem.rxadj.rules.RuleTablesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Quantity Limit Engine.
 * Checks a requested fill against per-fill, per-day, days-supply and accumulating limits.
 */
@Service
public class QuantityLimitEngine {

    private static final Logger log = LoggerFactory.getLogger(QuantityLimitEngine.class);

    private final RuleTablesRepository ruleTablesRepository;
    private final ClaimHistoryAccumulator accumulator;

    public QuantityLimitEngine(RuleTablesRepository ruleTablesRepository, ClaimHistoryAccumulator accumulator) {
        this.ruleTablesRepository = ruleTablesRepository;
        this.accumulator = accumulator;
    }

    /**
     * Check the requested quantity and days supply against every limit matching the drug.
     *
     * <p>The first failing limit in configuration order decides the result. When every
     * limit passes, the one allowing the smallest quantity decides it.
     *
     * @param drug drug being dispensed
     * @param requestedQuantity quantity requested, not negative
     * @param requestedDaysSupply days supply requested, not negative
     * @param claimHistory member's prior fills, empty when there are none
     * @param serviceDate date of service of the request
     * @return governing limit result
     */
    public QuantityLimitResult check(DrugIdentifier drug, BigDecimal requestedQuantity, int requestedDaysSupply,
                                     List<ClaimHistoryEntry> claimHistory, LocalDate serviceDate) {
        return check(ruleTablesRepository.current(), drug, requestedQuantity, requestedDaysSupply, claimHistory, serviceDate);
    }

    public QuantityLimitResult check(RuleTables tables, DrugIdentifier drug, BigDecimal requestedQuantity,
                                     int requestedDaysSupply, List<ClaimHistoryEntry> claimHistory,
                                     LocalDate serviceDate) {
        validateRequest(drug, requestedQuantity, requestedDaysSupply, claimHistory, serviceDate);

        List<QuantityLimit> limits = tables.quantityLimits().match(drug);
        if (limits.isEmpty()) {
            return QuantityLimitResult.unrestricted(requestedQuantity, requestedDaysSupply, "No quantity limits apply");
        }
        if (requestedQuantity.signum() == 0) {
            return QuantityLimitResult.unrestricted(requestedQuantity, requestedDaysSupply, "Zero quantity requested");
        }

        List<String> warnings = new ArrayList<>();
        List<QuantityLimitResult> results = evaluate(limits, drug, requestedQuantity, requestedDaysSupply,
                claimHistory, serviceDate, warnings);

        QuantityLimitResult selected = LimitSelection.select(results)
                .orElseGet(() -> QuantityLimitResult.unrestricted(requestedQuantity, requestedDaysSupply,
                        "No binding quantity limits apply"));

        log.debug("Quantity limit check: drug={}, requested={}/{}d, limits={}, selected={}, passed={}",
                drug.displayName(), requestedQuantity, requestedDaysSupply, limits.size(),
                selected.getLimitId(), selected.isPassed());

        if (warnings.isEmpty()) {
            return selected;
        }
        return selected.toBuilder().warnings(warnings).build();
    }

    /**
     * Result of every binding limit matching the drug, in configuration order.
     */
    public List<QuantityLimitResult> evaluateAll(DrugIdentifier drug, BigDecimal requestedQuantity,
                                                 int requestedDaysSupply, List<ClaimHistoryEntry> claimHistory,
                                                 LocalDate serviceDate) {
        validateRequest(drug, requestedQuantity, requestedDaysSupply, claimHistory, serviceDate);
        List<QuantityLimit> limits = ruleTablesRepository.current().quantityLimits().match(drug);
        return evaluate(limits, drug, requestedQuantity, requestedDaysSupply, claimHistory, serviceDate, new ArrayList<>());
    }

    private List<QuantityLimitResult> evaluate(List<QuantityLimit> limits, DrugIdentifier drug,
                                               BigDecimal requestedQuantity, int requestedDaysSupply,
                                               List<ClaimHistoryEntry> claimHistory, LocalDate serviceDate,
                                               List<String> warnings) {
        List<QuantityLimitResult> results = new ArrayList<>(limits.size());
        for (QuantityLimit limit : limits) {
            if (!limit.isBinding()) {
                log.warn("Ignoring non-binding quantity limit {}: neither maxQuantity nor maxDaysSupply is set",
                        limit.getLimitId());
                warnings.add("Quantity limit " + limit.getLimitId() + " is misconfigured (no maximum set) and was ignored");
                continue;
            }
            results.add(checkSingleLimit(limit, drug, requestedQuantity, requestedDaysSupply, claimHistory, serviceDate));
        }
        return results;
    }

    private QuantityLimitResult checkSingleLimit(QuantityLimit limit, DrugIdentifier drug,
                                                 BigDecimal requestedQuantity, int requestedDaysSupply,
                                                 List<ClaimHistoryEntry> claimHistory, LocalDate serviceDate) {
        return switch (limit.getLimitType()) {
            case PER_FILL -> checkPerFillLimit(limit, requestedQuantity, requestedDaysSupply);
            case PER_DAY -> checkPerDayLimit(limit, requestedQuantity, requestedDaysSupply);
            case MAX_DAYS_SUPPLY -> checkDaysSupplyLimit(limit, requestedQuantity, requestedDaysSupply);
            case PER_MONTH, PER_YEAR -> checkAccumulatingLimit(limit, drug, requestedQuantity, requestedDaysSupply,
                    claimHistory, serviceDate);
        };
    }

    private QuantityLimitResult checkPerFillLimit(QuantityLimit limit, BigDecimal requestedQuantity,
                                                  int requestedDaysSupply) {
        BigDecimal allowedQuantity = requestedQuantity;
        int allowedDays = requestedDaysSupply;
        List<String> messages = new ArrayList<>();

        if (limit.getMaxQuantity() != null && requestedQuantity.compareTo(limit.getMaxQuantity()) > 0) {
            allowedQuantity = limit.getMaxQuantity();
            messages.add("Quantity exceeds limit of " + limit.getMaxQuantity().toPlainString());
        }
        if (limit.getMaxDaysSupply() != null && requestedDaysSupply > limit.getMaxDaysSupply()) {
            allowedDays = limit.getMaxDaysSupply();
            messages.add("Days supply exceeds limit of " + limit.getMaxDaysSupply());
        }

        return baseResult(limit, requestedQuantity, requestedDaysSupply)
                .passed(messages.isEmpty())
                .allowedQuantity(allowedQuantity)
                .allowedDaysSupply(allowedDays)
                .message(messages.isEmpty() ? "Within per-fill limit" : String.join("; ", messages))
                .build();
    }

    private QuantityLimitResult checkPerDayLimit(QuantityLimit limit, BigDecimal requestedQuantity,
                                                 int requestedDaysSupply) {
        if (requestedDaysSupply == 0) {
            throw new InvalidRequestException("daysSupply",
                    "Days supply is required to check per-day limit " + limit.getLimitId());
        }
        BigDecimal days = BigDecimal.valueOf(requestedDaysSupply);
        BigDecimal dailyQuantity = requestedQuantity.divide(days, 4, RoundingMode.HALF_UP);
        BigDecimal allowedQuantity = requestedQuantity;
        int allowedDays = requestedDaysSupply;
        List<String> messages = new ArrayList<>();

        BigDecimal cap = limit.getMaxQuantity().multiply(days);
        if (requestedQuantity.compareTo(cap) > 0) {
            allowedQuantity = cap;
            messages.add("Daily quantity " + dailyQuantity.stripTrailingZeros().toPlainString()
                    + " exceeds limit of " + limit.getMaxQuantity().toPlainString() + " per day");
        }
        if (limit.getMaxDaysSupply() != null && requestedDaysSupply > limit.getMaxDaysSupply()) {
            allowedDays = limit.getMaxDaysSupply();
            messages.add("Days supply exceeds limit of " + limit.getMaxDaysSupply());
        }

        // reported maximum is the per-day cap scaled to the requested days supply
        return baseResult(limit, requestedQuantity, requestedDaysSupply)
                .passed(messages.isEmpty())
                .maxQuantity(cap)
                .allowedQuantity(allowedQuantity)
                .allowedDaysSupply(allowedDays)
                .message(messages.isEmpty() ? "Within per-day limit" : String.join("; ", messages))
                .build();
    }

    private QuantityLimitResult checkDaysSupplyLimit(QuantityLimit limit, BigDecimal requestedQuantity,
                                                     int requestedDaysSupply) {
        boolean exceeded = requestedDaysSupply > limit.getMaxDaysSupply();
        return baseResult(limit, requestedQuantity, requestedDaysSupply)
                .passed(!exceeded)
                .maxQuantity(null)
                .allowedQuantity(requestedQuantity)
                .allowedDaysSupply(exceeded ? limit.getMaxDaysSupply() : requestedDaysSupply)
                .message(exceeded
                        ? "Days supply exceeds maximum of " + limit.getMaxDaysSupply()
                        : "Within days supply limit")
                .build();
    }

    private QuantityLimitResult checkAccumulatingLimit(QuantityLimit limit, DrugIdentifier drug,
                                                       BigDecimal requestedQuantity, int requestedDaysSupply,
                                                       List<ClaimHistoryEntry> claimHistory, LocalDate serviceDate) {
        // history is keyed by NDC; without one the period usage cannot be computed
        if (!drug.hasNdc()) {
            throw new InvalidRequestException("drug.ndc",
                    "NDC is required to check accumulating limit " + limit.getLimitId());
        }
        BigDecimal used = accumulator.sumQuantity(claimHistory, drug.getNdc(), limit.getPeriodDays(), serviceDate);
        BigDecimal remaining = limit.getMaxQuantity().subtract(used).max(BigDecimal.ZERO);
        BigDecimal allowed = requestedQuantity.min(remaining);
        boolean passed = requestedQuantity.compareTo(remaining) <= 0;

        String message = passed
                ? "Within " + limit.getPeriodDays() + "-day limit"
                : "Exceeds " + limit.getPeriodDays() + "-day limit. Used: " + used.toPlainString()
                        + ", Max: " + limit.getMaxQuantity().toPlainString()
                        + ", Remaining: " + remaining.toPlainString();

        return baseResult(limit, requestedQuantity, requestedDaysSupply)
                .passed(passed)
                .allowedQuantity(allowed)
                .allowedDaysSupply(requestedDaysSupply)
                .quantityUsedInPeriod(used)
                .quantityRemainingInPeriod(remaining)
                .message(message)
                .build();
    }

    private QuantityLimitResult.QuantityLimitResultBuilder baseResult(QuantityLimit limit, BigDecimal requestedQuantity,
                                                                     int requestedDaysSupply) {
        return QuantityLimitResult.builder()
                .limitId(limit.getLimitId())
                .limitType(limit.getLimitType())
                .requestedQuantity(requestedQuantity)
                .maxQuantity(limit.getMaxQuantity())
                .requestedDaysSupply(requestedDaysSupply)
                .maxDaysSupply(limit.getMaxDaysSupply());
    }

    private void validateRequest(DrugIdentifier drug, BigDecimal requestedQuantity, int requestedDaysSupply,
                                 List<ClaimHistoryEntry> claimHistory, LocalDate serviceDate) {
        if (drug == null || (!drug.hasNdc() && !drug.hasGpi())) {
            throw new InvalidRequestException("drug", "Drug identifier with an NDC or GPI is required");
        }
        if (requestedQuantity == null) {
            throw new InvalidRequestException("quantity", "Requested quantity is required");
        }
        if (requestedQuantity.signum() < 0) {
            throw new InvalidRequestException("quantity", "Requested quantity cannot be negative: " + requestedQuantity);
        }
        if (requestedDaysSupply < 0) {
            throw new InvalidRequestException("daysSupply", "Requested days supply cannot be negative: " + requestedDaysSupply);
        }
        if (claimHistory == null) {
            throw new InvalidRequestException("claimHistory", "Claim history is required (use an empty list when the member has none)");
        }
        if (serviceDate == null) {
            throw new InvalidRequestException("serviceDate", "Service date is required");
        }
    }
}
