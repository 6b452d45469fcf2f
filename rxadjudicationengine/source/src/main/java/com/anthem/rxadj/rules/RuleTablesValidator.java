package com.anthem.rxadj.rules;

import com.anthem.rxadj.criteria.ClinicalCriteriaSet;
import com.anthem.rxadj.criteria.ClinicalCriterion;
import com.anthem.rxadj.dur.AgeRestriction;
import com.anthem.rxadj.dur.DrugInteraction;
import com.anthem.rxadj.dur.DuplicationClass;
import com.anthem.rxadj.dur.GenderRestriction;
import com.anthem.rxadj.dur.OverrideCombination;
import com.anthem.rxadj.dur.ProfessionalServiceCode;
import com.anthem.rxadj.dur.ResultOfServiceCode;
import com.anthem.rxadj.exception.RuleConfigurationException;
import com.anthem.rxadj.limits.QuantityLimit;
import com.anthem.rxadj.steptherapy.StepTherapyProtocol;
import com.anthem.rxadj.steptherapy.StepTherapyStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Validates rule tables before they are indexed into a {@link RuleTables} snapshot.
 *
 * <p>In strict mode a quantity limit with no maximum is rejected. In lenient mode it is
 * accepted with a warning and the quantity limit engine skips it at evaluation time.
 */
public class RuleTablesValidator {

    private static final Logger log = LoggerFactory.getLogger(RuleTablesValidator.class);

    private final boolean strict;

    public RuleTablesValidator() {
        this(true);
    }

    public RuleTablesValidator(boolean strict) {
        this.strict = strict;
    }

    /**
     * Validate the definition and build an indexed snapshot.
     *
     * @throws RuleConfigurationException listing every problem found
     */
    public RuleTables validateAndBuild(RuleTablesDefinition definition) {
        List<String> problems = validate(definition);
        if (!problems.isEmpty()) {
            throw new RuleConfigurationException(
                    "Rule tables version " + definition.getVersion() + " rejected", problems);
        }
        return RuleTables.index(definition);
    }

    public List<String> validate(RuleTablesDefinition definition) {
        List<String> problems = new ArrayList<>();

        checkUniqueIds("quantity limit", definition.getQuantityLimits(), QuantityLimit::getLimitId, problems);
        definition.getQuantityLimits().forEach(limit -> validateLimit(limit, problems));

        checkUniqueIds("interaction", definition.getDrugInteractions(), DrugInteraction::getInteractionId, problems);
        definition.getDrugInteractions().forEach(interaction -> validateInteraction(interaction, problems));

        checkUniqueIds("duplication class", definition.getDuplicationClasses(), DuplicationClass::getDuplicationId, problems);
        definition.getDuplicationClasses().forEach(duplication -> validateDuplication(duplication, problems));

        checkUniqueIds("age restriction", definition.getAgeRestrictions(), AgeRestriction::getRestrictionId, problems);
        definition.getAgeRestrictions().forEach(restriction -> validateAgeRestriction(restriction, problems));

        checkUniqueIds("gender restriction", definition.getGenderRestrictions(), GenderRestriction::getRestrictionId, problems);
        definition.getGenderRestrictions().forEach(restriction -> validateGenderRestriction(restriction, problems));

        checkUniqueIds("criteria set", definition.getCriteriaSets(), ClinicalCriteriaSet::getCriteriaSetId, problems);
        definition.getCriteriaSets().forEach(set -> validateCriteriaSet(set, problems));

        checkUniqueIds("step therapy protocol", definition.getStepTherapyProtocols(), StepTherapyProtocol::getProtocolId, problems);
        definition.getStepTherapyProtocols().forEach(protocol -> validateStepTherapy(protocol, problems));

        definition.getOverrideCombinations().forEach(combination -> validateOverrideCombination(combination, problems));

        return problems;
    }

    private void validateLimit(QuantityLimit limit, List<String> problems) {
        String id = limit.getLimitId();
        if (isBlank(limit.getDrugIdentifier())) {
            problems.add("Quantity limit " + id + " has no drug identifier");
        }
        if (limit.getLimitType() == null) {
            problems.add("Quantity limit " + id + " has no limit type");
            return;
        }
        if (!limit.isBinding()) {
            if (strict) {
                problems.add("Quantity limit " + id + " sets neither maxQuantity nor maxDaysSupply");
            } else {
                log.warn("Quantity limit {} sets neither maxQuantity nor maxDaysSupply and will be ignored", id);
            }
            return;
        }
        if (limit.getMaxQuantity() != null && limit.getMaxQuantity().signum() < 0) {
            problems.add("Quantity limit " + id + " has a negative maxQuantity");
        }
        if (limit.getMaxDaysSupply() != null && limit.getMaxDaysSupply() < 0) {
            problems.add("Quantity limit " + id + " has a negative maxDaysSupply");
        }
        switch (limit.getLimitType()) {
            case PER_MONTH, PER_YEAR -> {
                if (limit.getMaxQuantity() == null) {
                    problems.add("Accumulating limit " + id + " requires maxQuantity");
                }
                if (limit.getPeriodDays() <= 0) {
                    problems.add("Accumulating limit " + id + " requires a positive periodDays");
                }
            }
            case PER_DAY -> {
                if (limit.getMaxQuantity() == null) {
                    problems.add("Per-day limit " + id + " requires maxQuantity");
                }
            }
            case MAX_DAYS_SUPPLY -> {
                if (limit.getMaxDaysSupply() == null) {
                    problems.add("Days supply limit " + id + " requires maxDaysSupply");
                }
            }
            case PER_FILL -> {
                // either bound is enough
            }
        }
    }

    private void validateInteraction(DrugInteraction interaction, List<String> problems) {
        String id = interaction.getInteractionId();
        if (isBlank(interaction.getDrug1Gpi()) || isBlank(interaction.getDrug2Gpi())) {
            problems.add("Interaction " + id + " requires both class codes");
        }
        if (interaction.getClinicalSignificance() == null) {
            problems.add("Interaction " + id + " has no clinical significance");
        }
    }

    private void validateDuplication(DuplicationClass duplication, List<String> problems) {
        String id = duplication.getDuplicationId();
        if (isBlank(duplication.getGpiClass())) {
            problems.add("Duplication class " + id + " has no class code");
        }
        if (duplication.getMaxConcurrent() < 1) {
            problems.add("Duplication class " + id + " requires maxConcurrent of at least 1");
        }
    }

    private void validateAgeRestriction(AgeRestriction restriction, List<String> problems) {
        String id = restriction.getRestrictionId();
        if (isBlank(restriction.getDrugGpi())) {
            problems.add("Age restriction " + id + " has no class code");
        }
        if (restriction.getMinAge() == null && restriction.getMaxAge() == null) {
            problems.add("Age restriction " + id + " sets neither minAge nor maxAge");
        } else if (restriction.getMinAge() != null && restriction.getMaxAge() != null
                && restriction.getMinAge() > restriction.getMaxAge()) {
            problems.add("Age restriction " + id + " has minAge greater than maxAge");
        }
    }

    private void validateGenderRestriction(GenderRestriction restriction, List<String> problems) {
        String id = restriction.getRestrictionId();
        if (isBlank(restriction.getDrugGpi())) {
            problems.add("Gender restriction " + id + " has no class code");
        }
        if (restriction.getAllowedGender() == null) {
            problems.add("Gender restriction " + id + " has no allowed gender");
        }
    }

    private void validateCriteriaSet(ClinicalCriteriaSet set, List<String> problems) {
        String setId = set.getCriteriaSetId();
        if (isBlank(set.getDrugIdentifier())) {
            problems.add("Criteria set " + setId + " has no drug identifier");
        }
        checkUniqueIds("criterion in " + setId, set.getCriteria(), ClinicalCriterion::getCriterionId, problems);
        for (ClinicalCriterion criterion : set.getCriteria()) {
            problems.addAll(criterion.configurationProblems(setId + "/" + criterion.getCriterionId()));
        }
    }

    private void validateStepTherapy(StepTherapyProtocol protocol, List<String> problems) {
        String id = protocol.getProtocolId();
        if (isBlank(protocol.getDrugIdentifier())) {
            problems.add("Step therapy protocol " + id + " has no drug identifier");
        }
        if (protocol.getLookbackDays() <= 0) {
            problems.add("Step therapy protocol " + id + " requires a positive lookbackDays");
        }
        if (protocol.getSteps().isEmpty()) {
            problems.add("Step therapy protocol " + id + " has no steps");
        }
        Set<Integer> stepNumbers = new HashSet<>();
        for (StepTherapyStep step : protocol.getSteps()) {
            String stepId = id + "/" + step.getStepNumber();
            if (!stepNumbers.add(step.getStepNumber())) {
                problems.add("Duplicate step number in step therapy protocol " + stepId);
            }
            if (step.getRequiredDrugs().isEmpty() || step.getRequiredDrugs().stream().anyMatch(RuleTablesValidator::isBlank)) {
                problems.add("Step " + stepId + " must list required drugs without blanks");
            }
            if (step.getMinimumDays() < 0) {
                problems.add("Step " + stepId + " has a negative minimumDays");
            }
            if (step.getMinimumFills() < 1) {
                problems.add("Step " + stepId + " requires minimumFills of at least 1");
            }
        }
    }

    private void validateOverrideCombination(OverrideCombination combination, List<String> problems) {
        String professional = combination.getProfessionalService();
        if (ProfessionalServiceCode.fromCode(professional).isEmpty()) {
            problems.add("Unknown professional service code in override table: " + professional);
        }
        if (combination.getResultsOfService().isEmpty()) {
            problems.add("Override combination for " + professional + " lists no result of service codes");
        }
        for (String result : combination.getResultsOfService()) {
            if (ResultOfServiceCode.fromCode(result).isEmpty()) {
                problems.add("Unknown result of service code in override table: " + result);
            }
        }
    }

    private <T> void checkUniqueIds(String kind, List<T> items, Function<T, String> idOf, List<String> problems) {
        Set<String> seen = new HashSet<>();
        for (T item : items) {
            String id = idOf.apply(item);
            if (isBlank(id)) {
                problems.add("A " + kind + " has no id");
            } else if (!seen.add(id)) {
                problems.add("Duplicate " + kind + " id: " + id);
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
