package com.anthem.rxadj.criteria;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * One clinical requirement of a prior authorization criteria set.
 *
 * <p>Exactly one parameter group, the one matching {@link #type}, is populated:
 * <ul>
 *   <li>DIAGNOSIS: {@code diagnosisCodes} (ICD-10 prefixes)</li>
 *   <li>PREVIOUS_THERAPY: {@code requiredTherapies} (names or product codes)</li>
 *   <li>AGE: {@code minAge} and/or {@code maxAge}</li>
 *   <li>SPECIALIST: {@code specialistTypes}</li>
 *   <li>LAB_RESULT: {@code labTest} with {@code labMinValue} and/or {@code labMaxValue}</li>
 *   <li>QUANTITY: {@code maxQuantity} and/or {@code maxDaysSupply}</li>
 * </ul>
 */
@Value
@Builder
@Jacksonized
public class ClinicalCriterion {

    String criterionId;
    CriterionType type;
    String description;

    @Builder.Default
    boolean required = true;

    @Singular
    List<String> diagnosisCodes;

    @Singular
    List<String> requiredTherapies;

    Integer minAge;
    Integer maxAge;

    @Singular
    List<String> specialistTypes;

    String labTest;
    BigDecimal labMinValue;
    BigDecimal labMaxValue;

    BigDecimal maxQuantity;
    Integer maxDaysSupply;

    /**
     * Parameter groups that carry values, used to verify a criterion is well formed.
     */
    public List<CriterionType> populatedParameterGroups() {
        List<CriterionType> groups = new ArrayList<>();
        if (!diagnosisCodes.isEmpty()) {
            groups.add(CriterionType.DIAGNOSIS);
        }
        if (!requiredTherapies.isEmpty()) {
            groups.add(CriterionType.PREVIOUS_THERAPY);
        }
        if (minAge != null || maxAge != null) {
            groups.add(CriterionType.AGE);
        }
        if (!specialistTypes.isEmpty()) {
            groups.add(CriterionType.SPECIALIST);
        }
        if (labTest != null && !labTest.isBlank()) {
            groups.add(CriterionType.LAB_RESULT);
        }
        if (maxQuantity != null || maxDaysSupply != null) {
            groups.add(CriterionType.QUANTITY);
        }
        return groups;
    }

    /**
     * Problems that make this criterion unusable for evaluation, empty when it is well formed.
     *
     * @param label identifies the criterion in the messages
     */
    public List<String> configurationProblems(String label) {
        if (type == null) {
            return List.of("Criterion " + label + " has no type");
        }
        List<String> problems = new ArrayList<>();
        List<CriterionType> groups = populatedParameterGroups();
        if (groups.size() != 1 || groups.get(0) != type) {
            problems.add("Criterion " + label + " of type " + type
                    + " must populate exactly its own parameters, found " + groups);
        }
        if (type == CriterionType.LAB_RESULT && labMinValue == null && labMaxValue == null) {
            problems.add("Criterion " + label + " names lab " + labTest + " without bounds");
        }
        return problems;
    }

    /**
     * Description for unmet-criteria messages, the criterion id when none is configured.
     */
    public String displayDescription() {
        return description != null && !description.isBlank() ? description : criterionId;
    }
}
