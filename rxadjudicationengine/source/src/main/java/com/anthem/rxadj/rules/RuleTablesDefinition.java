package com.anthem.rxadj.rules;

import com.anthem.rxadj.criteria.ClinicalCriteriaSet;
import com.anthem.rxadj.dur.AgeRestriction;
import com.anthem.rxadj.dur.DrugInteraction;
import com.anthem.rxadj.dur.DuplicationClass;
import com.anthem.rxadj.dur.GenderRestriction;
import com.anthem.rxadj.dur.OverrideCombination;
import com.anthem.rxadj.limits.QuantityLimit;
import com.anthem.rxadj.steptherapy.StepTherapyProtocol;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Raw rule tables as supplied by configuration, before validation and indexing.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleTablesDefinition {

    String version;

    @Singular
    List<QuantityLimit> quantityLimits;

    @Singular
    List<DrugInteraction> drugInteractions;

    @Singular
    List<DuplicationClass> duplicationClasses;

    @Singular
    List<AgeRestriction> ageRestrictions;

    @Singular
    List<GenderRestriction> genderRestrictions;

    @Singular
    List<ClinicalCriteriaSet> criteriaSets;

    @Singular
    List<StepTherapyProtocol> stepTherapyProtocols;

    @Singular
    List<OverrideCombination> overrideCombinations;
}
