package com.anthem.rxadj.adjudication;

/**
 * Outcome of claim adjudication, in order of precedence.
 */
public enum AdjudicationDecision {
    PRIOR_AUTH_REQUIRED,
    STEP_THERAPY_REQUIRED,
    REJECTED_QUANTITY_LIMIT,
    OVERRIDE_REQUIRED,
    PROCEED
}
