package com.anthem.rxadj.dur;

import com.anthem.rxadj.history.ClaimHistoryEntry;
import com.anthem.rxadj.model.MemberClinicalContext;
import com.anthem.rxadj.model.PharmacyClaim;
import com.anthem.rxadj.rules.RuleTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * DUR Validator.
 * Runs the DUR rules engine for a claim and classifies the alerts by severity.
 */
@Service
public class DurValidator {

    private static final Logger log = LoggerFactory.getLogger(DurValidator.class);

    private final DurRulesEngine rulesEngine;

    public DurValidator(DurRulesEngine rulesEngine) {
        this.rulesEngine = rulesEngine;
    }

    /**
     * Validate a claim against DUR rules.
     *
     * @param claim claim under review
     * @param member member clinical context, including current medications
     * @param history member's prior fills
     * @return result with {@code passed} false whenever a level 1 alert fired
     */
    public DurValidationResult validate(PharmacyClaim claim, MemberClinicalContext member,
                                        List<ClaimHistoryEntry> history) {
        return classify(claim, rulesEngine.run(context(claim, member, history)));
    }

    public DurValidationResult validate(PharmacyClaim claim, MemberClinicalContext member,
                                        List<ClaimHistoryEntry> history, RuleTables tables) {
        return classify(claim, rulesEngine.run(context(claim, member, history), tables));
    }

    private DurContext context(PharmacyClaim claim, MemberClinicalContext member, List<ClaimHistoryEntry> history) {
        return DurContext.builder()
                .claim(claim)
                .member(member)
                .history(history == null ? List.of() : history)
                .build();
    }

    private DurValidationResult classify(PharmacyClaim claim, List<DurAlert> alerts) {
        Map<ClinicalSignificance, Integer> bySeverity = new EnumMap<>(ClinicalSignificance.class);
        Map<DurAlertType, Integer> byType = new EnumMap<>(DurAlertType.class);
        for (DurAlert alert : alerts) {
            bySeverity.merge(alert.getClinicalSignificance(), 1, Integer::sum);
            byType.merge(alert.getAlertType(), 1, Integer::sum);
        }

        int major = bySeverity.getOrDefault(ClinicalSignificance.LEVEL_1, 0);
        DurValidationResult.DurValidationResultBuilder result = DurValidationResult.builder()
                .claimId(claim.getClaimId())
                .passed(major == 0)
                .alerts(alerts)
                .totalAlerts(alerts.size())
                .majorAlerts(major)
                .moderateAlerts(bySeverity.getOrDefault(ClinicalSignificance.LEVEL_2, 0))
                .minorAlerts(bySeverity.getOrDefault(ClinicalSignificance.LEVEL_3, 0))
                .requiresOverride(major > 0);

        byType.forEach((type, count) -> result.message(count + " " + type.getDisplayName() + " alert(s) found"));

        if (!alerts.isEmpty()) {
            log.info("DUR alerts: claimId={}, total={}, major={}", claim.getClaimId(), alerts.size(), major);
        }
        return result.build();
    }
}
