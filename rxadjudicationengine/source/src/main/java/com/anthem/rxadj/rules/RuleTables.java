package com.anthem.rxadj.rules;

import com.anthem.rxadj.criteria.ClinicalCriteriaSet;
import com.anthem.rxadj.drug.DrugRuleIndex;
import com.anthem.rxadj.dur.AgeRestriction;
import com.anthem.rxadj.dur.DrugInteraction;
import com.anthem.rxadj.dur.DuplicationClass;
import com.anthem.rxadj.dur.GenderRestriction;
import com.anthem.rxadj.dur.OverrideCombination;
import com.anthem.rxadj.limits.QuantityLimit;
import com.anthem.rxadj.steptherapy.StepTherapyProtocol;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, indexed snapshot of every static rule table.
 *
 * <p>A snapshot is built once, validated by {@link RuleTablesValidator} and then only read.
 * Reloading builds a new snapshot and swaps it in {@link RuleTablesRepository}, so readers
 * never observe a partially updated table.
 */
public final class RuleTables {

    private final String version;
    private final List<QuantityLimit> quantityLimits;
    private final List<DrugInteraction> drugInteractions;
    private final List<DuplicationClass> duplicationClasses;
    private final List<AgeRestriction> ageRestrictions;
    private final List<GenderRestriction> genderRestrictions;
    private final List<ClinicalCriteriaSet> criteriaSets;
    private final List<StepTherapyProtocol> stepTherapyProtocols;
    private final Map<String, Set<String>> validOverrideCombinations;

    private final DrugRuleIndex<QuantityLimit> quantityLimitIndex;
    private final DrugRuleIndex<DrugInteraction> interactionsByDrug1;
    private final DrugRuleIndex<DrugInteraction> interactionsByDrug2;
    private final DrugRuleIndex<DuplicationClass> duplicationIndex;
    private final DrugRuleIndex<AgeRestriction> ageRestrictionIndex;
    private final DrugRuleIndex<GenderRestriction> genderRestrictionIndex;
    private final DrugRuleIndex<ClinicalCriteriaSet> criteriaSetIndex;
    private final DrugRuleIndex<StepTherapyProtocol> stepTherapyIndex;

    private RuleTables(RuleTablesDefinition definition) {
        this.version = definition.getVersion();
        this.quantityLimits = List.copyOf(definition.getQuantityLimits());
        this.drugInteractions = List.copyOf(definition.getDrugInteractions());
        this.duplicationClasses = List.copyOf(definition.getDuplicationClasses());
        this.ageRestrictions = List.copyOf(definition.getAgeRestrictions());
        this.genderRestrictions = List.copyOf(definition.getGenderRestrictions());
        this.criteriaSets = List.copyOf(definition.getCriteriaSets());
        this.stepTherapyProtocols = List.copyOf(definition.getStepTherapyProtocols());
        this.validOverrideCombinations = combinationTable(definition.getOverrideCombinations());

        this.quantityLimitIndex = DrugRuleIndex.of(quantityLimits, QuantityLimit::getDrugIdentifier);
        this.interactionsByDrug1 = DrugRuleIndex.of(drugInteractions, DrugInteraction::getDrug1Gpi);
        this.interactionsByDrug2 = DrugRuleIndex.of(drugInteractions, DrugInteraction::getDrug2Gpi);
        this.duplicationIndex = DrugRuleIndex.of(duplicationClasses, DuplicationClass::getGpiClass);
        this.ageRestrictionIndex = DrugRuleIndex.of(ageRestrictions, AgeRestriction::getDrugGpi);
        this.genderRestrictionIndex = DrugRuleIndex.of(genderRestrictions, GenderRestriction::getDrugGpi);
        this.criteriaSetIndex = DrugRuleIndex.of(criteriaSets, ClinicalCriteriaSet::getDrugIdentifier);
        this.stepTherapyIndex = DrugRuleIndex.of(stepTherapyProtocols, StepTherapyProtocol::getDrugIdentifier);
    }

    /**
     * Index the definition without validating it. Callers outside this package go through
     * {@link RuleTablesValidator#validateAndBuild}.
     */
    static RuleTables index(RuleTablesDefinition definition) {
        return new RuleTables(definition);
    }

    public static RuleTables empty() {
        return new RuleTables(RuleTablesDefinition.builder().version("empty").build());
    }

    private static Map<String, Set<String>> combinationTable(List<OverrideCombination> combinations) {
        Map<String, Set<String>> table = new LinkedHashMap<>();
        for (OverrideCombination combination : combinations) {
            table.computeIfAbsent(combination.getProfessionalService(), k -> new LinkedHashSet<>())
                    .addAll(combination.getResultsOfService());
        }
        table.replaceAll((k, v) -> Set.copyOf(v));
        return Map.copyOf(table);
    }

    public String getVersion() {
        return version;
    }

    public List<QuantityLimit> getQuantityLimits() {
        return quantityLimits;
    }

    public List<DrugInteraction> getDrugInteractions() {
        return drugInteractions;
    }

    public List<DuplicationClass> getDuplicationClasses() {
        return duplicationClasses;
    }

    public List<AgeRestriction> getAgeRestrictions() {
        return ageRestrictions;
    }

    public List<GenderRestriction> getGenderRestrictions() {
        return genderRestrictions;
    }

    public List<ClinicalCriteriaSet> getCriteriaSets() {
        return criteriaSets;
    }

    public List<StepTherapyProtocol> getStepTherapyProtocols() {
        return stepTherapyProtocols;
    }

    /**
     * Professional service code to the result-of-service codes allowed with it.
     */
    public Map<String, Set<String>> getValidOverrideCombinations() {
        return validOverrideCombinations;
    }

    public DrugRuleIndex<QuantityLimit> quantityLimits() {
        return quantityLimitIndex;
    }

    public DrugRuleIndex<DrugInteraction> interactionsByDrug1() {
        return interactionsByDrug1;
    }

    public DrugRuleIndex<DrugInteraction> interactionsByDrug2() {
        return interactionsByDrug2;
    }

    public DrugRuleIndex<DuplicationClass> duplicationClasses() {
        return duplicationIndex;
    }

    public DrugRuleIndex<AgeRestriction> ageRestrictions() {
        return ageRestrictionIndex;
    }

    public DrugRuleIndex<GenderRestriction> genderRestrictions() {
        return genderRestrictionIndex;
    }

    public DrugRuleIndex<ClinicalCriteriaSet> criteriaSets() {
        return criteriaSetIndex;
    }

    public DrugRuleIndex<StepTherapyProtocol> stepTherapyProtocols() {
        return stepTherapyIndex;
    }
}
