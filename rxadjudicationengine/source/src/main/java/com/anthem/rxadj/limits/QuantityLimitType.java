package com.anthem.rxadj.limits;

/**
 * Kinds of quantity limit a plan can place on a drug.
 */
public enum QuantityLimitType {
    PER_FILL,
    PER_DAY,
    PER_MONTH,
    PER_YEAR,
    MAX_DAYS_SUPPLY;

    /**
     * Accumulating limits cap quantity over a trailing window of claim history.
     */
    public boolean isAccumulating() {
        return this == PER_MONTH || this == PER_YEAR;
    }
}
