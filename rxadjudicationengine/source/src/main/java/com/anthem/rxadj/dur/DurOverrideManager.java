package com.anthem.rxadj.dur;

import com.anthem.rxadj.exception.InvalidOverrideException;
import com.anthem.rxadj.rules.RuleTables;
import com.anthem.rxadj.rules.RuleTablesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DUR Override Manager.
 * Validates override codes, records overrides and summarizes alerts with their overrides.
 */
@Service
public class DurOverrideManager {

    private static final Logger log = LoggerFactory.getLogger(DurOverrideManager.class);

    private final RuleTablesRepository ruleTablesRepository;
    private final Clock clock;

    public DurOverrideManager(RuleTablesRepository ruleTablesRepository, Clock clock) {
        this.ruleTablesRepository = ruleTablesRepository;
        this.clock = clock;
    }

    /**
     * Check both codes against the closed NCPDP code sets and the table of valid combinations.
     */
    public OverrideValidation validateOverride(DurOverride override) {
        return validateOverride(override, ruleTablesRepository.current());
    }

    public OverrideValidation validateOverride(DurOverride override, RuleTables tables) {
        if (override == null) {
            return OverrideValidation.rejected("Override is required");
        }
        String professional = override.getProfessionalService();
        String result = override.getResultOfService();

        if (ProfessionalServiceCode.fromCode(professional).isEmpty()) {
            return OverrideValidation.rejected("Invalid professional service code: " + professional);
        }
        if (ResultOfServiceCode.fromCode(result).isEmpty()) {
            return OverrideValidation.rejected("Invalid result of service code: " + result);
        }

        Map<String, Set<String>> combinations = tables.getValidOverrideCombinations();
        Set<String> allowedResults = combinations.getOrDefault(professional, Set.of());
        if (!allowedResults.contains(result)) {
            return OverrideValidation.rejected(String.format(
                    "Result of service %s is not valid with professional service %s", result, professional));
        }
        return OverrideValidation.accepted();
    }

    /**
     * Record an override for an alert.
     *
     * @throws InvalidOverrideException when the code pair is not allowed
     */
    public DurOverride createOverride(DurAlert alert, String professionalService, String resultOfService,
                                      String actorId, String notes) {
        DurOverride override = DurOverride.builder()
                .alertType(alert.getAlertType())
                .reasonForService(alert.getReasonForService())
                .professionalService(professionalService)
                .resultOfService(resultOfService)
                .actorId(actorId)
                .overrideDate(LocalDate.now(clock))
                .notes(notes)
                .build();

        OverrideValidation validation = validateOverride(override);
        if (!validation.isValid()) {
            log.warn("DUR override rejected: alertType={}, actor={}, reason={}",
                    alert.getAlertType(), actorId, validation.getReason());
            throw new InvalidOverrideException(validation.getReason());
        }

        log.info("DUR override recorded: alertType={}, codes={}/{}, actor={}",
                alert.getAlertType(), professionalService, resultOfService, actorId);
        return override;
    }

    /**
     * Copy of the alert carrying the override's codes. The original alert is left unchanged.
     */
    public DurAlert applyOverrideToAlert(DurAlert alert, DurOverride override) {
        return alert.toBuilder()
                .professionalService(override.getProfessionalService())
                .resultOfService(override.getResultOfService())
                .build();
    }

    /**
     * Summarize alerts for a claim. The claim can proceed unless a level 1 alert lacks a
     * valid override of the same alert type.
     */
    public DurAlertSummary summarize(String claimId, List<DurAlert> alerts, List<DurOverride> overrides) {
        return summarize(claimId, alerts, overrides, ruleTablesRepository.current());
    }

    public DurAlertSummary summarize(String claimId, List<DurAlert> alerts, List<DurOverride> overrides,
                                     RuleTables tables) {
        List<DurOverride> validOverrides = new ArrayList<>();
        for (DurOverride override : overrides == null ? List.<DurOverride>of() : overrides) {
            OverrideValidation validation = validateOverride(override, tables);
            if (validation.isValid()) {
                validOverrides.add(override);
            } else {
                log.warn("Ignoring invalid DUR override on claim {}: {}", claimId, validation.getReason());
            }
        }

        int level1 = 0;
        int level2 = 0;
        int level3 = 0;
        int uncovered = 0;
        for (DurAlert alert : alerts) {
            switch (alert.getClinicalSignificance()) {
                case LEVEL_1 -> {
                    level1++;
                    if (!isCovered(alert, validOverrides)) {
                        uncovered++;
                    }
                }
                case LEVEL_2 -> level2++;
                case LEVEL_3 -> level3++;
            }
        }

        DurAlertSummary.DurAlertSummaryBuilder summary = DurAlertSummary.builder()
                .claimId(claimId)
                .totalAlerts(alerts.size())
                .level1Alerts(level1)
                .level2Alerts(level2)
                .level3Alerts(level3)
                .alerts(alerts)
                .requiresOverride(level1 > 0)
                .overrideProvided(!validOverrides.isEmpty())
                .canProceed(uncovered == 0);

        for (DurOverride override : validOverrides) {
            summary.overrideCode(override.getProfessionalService() + "/" + override.getResultOfService());
        }
        if (uncovered > 0) {
            summary.rejectionReason(uncovered + " major DUR alert(s) require pharmacist override");
        }
        return summary.build();
    }

    private boolean isCovered(DurAlert alert, List<DurOverride> overrides) {
        for (DurOverride override : overrides) {
            if (override.getAlertType() == alert.getAlertType()) {
                return true;
            }
        }
        return false;
    }
}
