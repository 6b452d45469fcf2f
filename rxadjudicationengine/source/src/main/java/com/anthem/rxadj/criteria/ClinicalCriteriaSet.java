package com.anthem.rxadj.criteria;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Criteria a drug must satisfy for prior authorization. All required criteria must be met.
 */
@Value
@Builder
@Jacksonized
public class ClinicalCriteriaSet {

    String criteriaSetId;

    /** NDC or GPI prefix of the governed drug */
    String drugIdentifier;

    String drugName;
    String description;

    @Singular("criterion")
    List<ClinicalCriterion> criteria;
}
