package com.anthem.rxadj.criteria;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class CriteriaEvaluationResult {

    String criteriaSetId;
    boolean met;
    int criteriaEvaluated;
    int metCount;

    /** Descriptions of required criteria that were not met, for denial messaging */
    @Singular
    List<String> unmetDescriptions;

    /** Criterion id to outcome, in evaluation order */
    @Singular
    Map<String, Boolean> details;
}
