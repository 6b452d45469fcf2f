package com.anthem.rxadj.adjudication;

import com.anthem.rxadj.criteria.ClinicalCriteriaEvaluator;
import com.anthem.rxadj.criteria.ClinicalCriteriaSet;
import com.anthem.rxadj.dur.DurAlert;
import com.anthem.rxadj.dur.DurAlertFormatter;
import com.anthem.rxadj.dur.DurAlertSummary;
import com.anthem.rxadj.dur.DurOverride;
import com.anthem.rxadj.dur.DurOverrideManager;
import com.anthem.rxadj.dur.DurValidationResult;
import com.anthem.rxadj.dur.DurValidator;
import com.anthem.rxadj.exception.InvalidRequestException;
import com.anthem.rxadj.history.ClaimHistoryEntry;
import com.anthem.rxadj.limits.QuantityLimitEngine;
import com.anthem.rxadj.limits.QuantityLimitResult;
import com.anthem.rxadj.model.MemberClinicalContext;
import com.anthem.rxadj.model.PharmacyClaim;
import com.anthem.rxadj.pa.PriorAuthResponse;
import com.anthem.rxadj.pa.PriorAuthWorkflow;
import com.anthem.rxadj.rules.RuleTables;
import com.anthem.rxadj.rules.RuleTablesRepository;
import com.anthem.rxadj.steptherapy.StepTherapyEvaluator;
import com.anthem.rxadj.steptherapy.StepTherapyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Adjudicates a pharmacy claim: quantity limits, DUR, step therapy and prior authorization gating.
 *
 * <p>Every check runs against the same rule snapshot before the decision is made, so the
 * result always carries the full picture. Precedence: prior authorization, step therapy,
 * quantity limit, uncovered major DUR alert, proceed. An active authorization for the member
 * and drug satisfies both the prior authorization and the step therapy requirement.
 */
@Service
public class ClaimAdjudicationService {

    private static final Logger log = LoggerFactory.getLogger(ClaimAdjudicationService.class);

    private final RuleTablesRepository ruleTablesRepository;
    private final QuantityLimitEngine quantityLimitEngine;
    private final DurValidator durValidator;
    private final DurOverrideManager overrideManager;
    private final DurAlertFormatter alertFormatter;
    private final ClinicalCriteriaEvaluator criteriaEvaluator;
    private final StepTherapyEvaluator stepTherapyEvaluator;
    private final PriorAuthWorkflow priorAuthWorkflow;

    public ClaimAdjudicationService(RuleTablesRepository ruleTablesRepository,
                                    QuantityLimitEngine quantityLimitEngine,
                                    DurValidator durValidator,
                                    DurOverrideManager overrideManager,
                                    DurAlertFormatter alertFormatter,
                                    ClinicalCriteriaEvaluator criteriaEvaluator,
                                    StepTherapyEvaluator stepTherapyEvaluator,
                                    PriorAuthWorkflow priorAuthWorkflow) {
        this.ruleTablesRepository = ruleTablesRepository;
        this.quantityLimitEngine = quantityLimitEngine;
        this.durValidator = durValidator;
        this.overrideManager = overrideManager;
        this.alertFormatter = alertFormatter;
        this.criteriaEvaluator = criteriaEvaluator;
        this.stepTherapyEvaluator = stepTherapyEvaluator;
        this.priorAuthWorkflow = priorAuthWorkflow;
    }

    public AdjudicationResult adjudicate(PharmacyClaim claim, MemberClinicalContext member,
                                         List<ClaimHistoryEntry> history, List<DurOverride> overrides) {
        if (claim == null) {
            throw new InvalidRequestException("claim", "Claim is required");
        }
        RuleTables tables = ruleTablesRepository.current();

        QuantityLimitResult quantityResult = quantityLimitEngine.check(tables, claim.getDrug(), claim.getQuantity(),
                claim.getDaysSupply(), history, claim.getServiceDate());
        DurValidationResult durResult = durValidator.validate(claim, member, history, tables);
        DurAlertSummary durSummary = overrideManager.summarize(claim.getClaimId(), durResult.getAlerts(),
                overrides == null ? List.of() : overrides, tables);

        Optional<ClinicalCriteriaSet> criteriaSet = criteriaEvaluator.findCriteriaSet(tables, claim.getDrug());
        Optional<StepTherapyResult> stepTherapy = stepTherapyEvaluator.check(tables, claim.getDrug(), history,
                claim.getServiceDate());
        boolean stepTherapyUnmet = stepTherapy.map(r -> !r.isSatisfied()).orElse(false);
        String priorAuthNumber = claim.getPriorAuthNumber();
        boolean priorAuthNumberPresent = priorAuthNumber != null && !priorAuthNumber.isBlank();
        boolean priorAuthNumberRejected = false;
        Optional<PriorAuthResponse> existingAuth = Optional.empty();
        if (criteriaSet.isPresent() || stepTherapyUnmet) {
            if (priorAuthNumberPresent) {
                existingAuth = priorAuthWorkflow.findAuthorization(priorAuthNumber, claim.getMemberId(),
                        claim.getDrug(), claim.getServiceDate());
                priorAuthNumberRejected = existingAuth.isEmpty();
            }
            if (existingAuth.isEmpty()) {
                existingAuth = priorAuthWorkflow.checkExistingAuth(claim.getMemberId(), claim.getDrug(),
                        claim.getServiceDate());
            }
        }
        boolean priorAuthRequired = criteriaSet.isPresent() && existingAuth.isEmpty();
        boolean stepTherapyRequired = stepTherapyUnmet && existingAuth.isEmpty();
        if (priorAuthNumberRejected) {
            log.warn("Prior authorization number on claim not recognized: claimId={}, paNumber={}",
                    claim.getClaimId(), priorAuthNumber);
        }

        AdjudicationResult.AdjudicationResultBuilder result = AdjudicationResult.builder()
                .claimId(claim.getClaimId())
                .quantityResult(quantityResult)
                .durResult(durResult)
                .durSummary(durSummary)
                .priorAuthRequired(priorAuthRequired)
                .criteriaSetId(criteriaSet.map(ClinicalCriteriaSet::getCriteriaSetId).orElse(null))
                .existingAuthorization(existingAuth.orElse(null))
                .stepTherapyResult(stepTherapy.orElse(null))
                .stepTherapyRequired(stepTherapyRequired);

        AdjudicationDecision decision;
        if (priorAuthRequired) {
            decision = AdjudicationDecision.PRIOR_AUTH_REQUIRED;
            result.message("Prior authorization required: " + criteriaSet.get().getDescription());
        } else if (stepTherapyRequired) {
            decision = AdjudicationDecision.STEP_THERAPY_REQUIRED;
            result.message(stepTherapy.get().getMessage());
        } else if (!quantityResult.isPassed()) {
            decision = AdjudicationDecision.REJECTED_QUANTITY_LIMIT;
            result.message(quantityResult.getMessage());
        } else if (!durSummary.isCanProceed()) {
            decision = AdjudicationDecision.OVERRIDE_REQUIRED;
            result.message(durSummary.getRejectionReason());
        } else {
            decision = AdjudicationDecision.PROCEED;
        }
        if (priorAuthNumberRejected) {
            result.message("Prior authorization number " + priorAuthNumber.trim()
                    + " is not an active authorization for this member and drug");
        }
        for (DurAlert alert : durResult.getAlerts()) {
            result.message(alertFormatter.formatSummaryLine(alert));
        }

        log.info("Claim adjudicated: claimId={}, decision={}, qlPassed={}, durAlerts={}, paRequired={}, stRequired={}, rules={}",
                claim.getClaimId(), decision, quantityResult.isPassed(), durResult.getTotalAlerts(),
                priorAuthRequired, stepTherapyRequired, tables.getVersion());
        return result.decision(decision).build();
    }
}
