package com.anthem.rxadj.criteria;

public enum CriterionType {
    DIAGNOSIS,
    PREVIOUS_THERAPY,
    AGE,
    SPECIALIST,
    LAB_RESULT,
    QUANTITY
}
