package com.anthem.rxadj.criteria;

import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.exception.InvalidRequestException;
import com.anthem.rxadj.exception.RuleConfigurationException;
import com.anthem.rxadj.model.MemberClinicalContext;
import com.anthem.rxadj.rules.RuleTables;
import com.anthem.rxadj.rules.RuleTablesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Clinical Criteria Evaluator.
 * Evaluates a criteria set against a member's clinical context. A set is met when every
 * required criterion is met; an empty set is met.
 */
@Service
public class ClinicalCriteriaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ClinicalCriteriaEvaluator.class);

    private final RuleTablesRepository ruleTablesRepository;
    private final Clock clock;

    public ClinicalCriteriaEvaluator(RuleTablesRepository ruleTablesRepository, Clock clock) {
        this.ruleTablesRepository = ruleTablesRepository;
        this.clock = clock;
    }

    /**
     * Criteria set governing the drug, first match in configuration order.
     */
    public Optional<ClinicalCriteriaSet> findCriteriaSet(DrugIdentifier drug) {
        return findCriteriaSet(ruleTablesRepository.current(), drug);
    }

    public Optional<ClinicalCriteriaSet> findCriteriaSet(RuleTables tables, DrugIdentifier drug) {
        return tables.criteriaSets().match(drug).stream().findFirst();
    }

    public CriteriaEvaluationResult evaluate(ClinicalCriteriaSet criteriaSet, MemberClinicalContext context) {
        return evaluate(criteriaSet, context, null, null);
    }

    /**
     * Evaluate with the requested quantity and days supply, needed by QUANTITY criteria.
     *
     * @throws InvalidRequestException when a criterion needs a value the request does not carry
     * @throws RuleConfigurationException when the set contains a malformed criterion
     */
    public CriteriaEvaluationResult evaluate(ClinicalCriteriaSet criteriaSet, MemberClinicalContext context,
                                             BigDecimal requestedQuantity, Integer requestedDaysSupply) {
        if (criteriaSet == null) {
            throw new InvalidRequestException("criteriaSet", "Criteria set is required for criteria evaluation");
        }
        if (context == null) {
            throw new InvalidRequestException("context", "Clinical context is required for criteria evaluation");
        }
        checkWellFormed(criteriaSet);

        CriteriaEvaluationResult.CriteriaEvaluationResultBuilder result = CriteriaEvaluationResult.builder()
                .criteriaSetId(criteriaSet.getCriteriaSetId());
        int metCount = 0;
        boolean allRequiredMet = true;

        for (ClinicalCriterion criterion : criteriaSet.getCriteria()) {
            boolean met = switch (criterion.getType()) {
                case DIAGNOSIS -> diagnosisMet(criterion, context);
                case PREVIOUS_THERAPY -> therapyMet(criterion, context);
                case AGE -> ageMet(criterion, context);
                case SPECIALIST -> specialistMet(criterion, context);
                case LAB_RESULT -> labMet(criterion, context);
                case QUANTITY -> quantityMet(criterion, requestedQuantity, requestedDaysSupply);
            };
            result.detail(criterion.getCriterionId(), met);
            if (met) {
                metCount++;
            } else if (criterion.isRequired()) {
                allRequiredMet = false;
                result.unmetDescription(criterion.displayDescription());
            }
        }

        log.debug("Criteria evaluated: set={}, member={}, met={}, metCount={}/{}",
                criteriaSet.getCriteriaSetId(), context.getMemberId(), allRequiredMet,
                metCount, criteriaSet.getCriteria().size());

        return result
                .met(allRequiredMet)
                .criteriaEvaluated(criteriaSet.getCriteria().size())
                .metCount(metCount)
                .build();
    }

    private void checkWellFormed(ClinicalCriteriaSet criteriaSet) {
        List<String> problems = new ArrayList<>();
        for (ClinicalCriterion criterion : criteriaSet.getCriteria()) {
            problems.addAll(criterion.configurationProblems(
                    criteriaSet.getCriteriaSetId() + "/" + criterion.getCriterionId()));
        }
        if (!problems.isEmpty()) {
            throw new RuleConfigurationException(
                    "Criteria set " + criteriaSet.getCriteriaSetId() + " cannot be evaluated", problems);
        }
    }

    private boolean diagnosisMet(ClinicalCriterion criterion, MemberClinicalContext context) {
        for (String diagnosis : context.getDiagnosisCodes()) {
            String code = normalizeIcd(diagnosis);
            for (String required : criterion.getDiagnosisCodes()) {
                if (code.startsWith(normalizeIcd(required))) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean therapyMet(ClinicalCriterion criterion, MemberClinicalContext context) {
        for (String therapy : context.getPriorTherapies()) {
            for (String required : criterion.getRequiredTherapies()) {
                if (therapy.equalsIgnoreCase(required)) {
                    return true;
                }
                if (isNumeric(therapy) && isNumeric(required) && therapy.startsWith(required)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean ageMet(ClinicalCriterion criterion, MemberClinicalContext context) {
        Integer age = context.ageOn(LocalDate.now(clock));
        if (age == null) {
            throw new InvalidRequestException("age",
                    "Member age is required by criterion " + criterion.getCriterionId());
        }
        if (criterion.getMinAge() != null && age < criterion.getMinAge()) {
            return false;
        }
        return criterion.getMaxAge() == null || age <= criterion.getMaxAge();
    }

    private boolean specialistMet(ClinicalCriterion criterion, MemberClinicalContext context) {
        String specialty = context.getPrescriberSpecialty();
        if (specialty == null) {
            return false;
        }
        return criterion.getSpecialistTypes().stream().anyMatch(specialty::equalsIgnoreCase);
    }

    private boolean labMet(ClinicalCriterion criterion, MemberClinicalContext context) {
        BigDecimal value = context.getLabResults().get(criterion.getLabTest());
        if (value == null) {
            return false;
        }
        if (criterion.getLabMinValue() != null && value.compareTo(criterion.getLabMinValue()) < 0) {
            return false;
        }
        return criterion.getLabMaxValue() == null || value.compareTo(criterion.getLabMaxValue()) <= 0;
    }

    private boolean quantityMet(ClinicalCriterion criterion, BigDecimal requestedQuantity, Integer requestedDaysSupply) {
        if (criterion.getMaxQuantity() != null) {
            if (requestedQuantity == null) {
                throw new InvalidRequestException("quantityRequested",
                        "Requested quantity is required by criterion " + criterion.getCriterionId());
            }
            if (requestedQuantity.compareTo(criterion.getMaxQuantity()) > 0) {
                return false;
            }
        }
        if (criterion.getMaxDaysSupply() != null) {
            if (requestedDaysSupply == null) {
                throw new InvalidRequestException("daysSupplyRequested",
                        "Requested days supply is required by criterion " + criterion.getCriterionId());
            }
            return requestedDaysSupply <= criterion.getMaxDaysSupply();
        }
        return true;
    }

    private static String normalizeIcd(String code) {
        return code.replace(".", "").toUpperCase(Locale.ROOT);
    }

    private static boolean isNumeric(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }
}
