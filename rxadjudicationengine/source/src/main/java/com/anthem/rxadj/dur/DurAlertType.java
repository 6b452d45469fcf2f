package com.anthem.rxadj.dur;

/**
 * DUR conflict types raised by the rules engine, with their NCPDP conflict and
 * reason-for-service codes.
 */
public enum DurAlertType {
    DRUG_DRUG("DD", "MA", "Drug-Drug Interaction"),
    THERAPEUTIC_DUPLICATION("TD", "TD", "Therapeutic Duplication"),
    EARLY_REFILL("ER", "ER", "Early Refill"),
    DRUG_AGE("PA", "PA", "Age Precaution"),
    DRUG_GENDER("PG", "PG", "Gender Precaution");

    private final String conflictCode;
    private final String reasonForService;
    private final String displayName;

    DurAlertType(String conflictCode, String reasonForService, String displayName) {
        this.conflictCode = conflictCode;
        this.reasonForService = reasonForService;
        this.displayName = displayName;
    }

    public String getConflictCode() {
        return conflictCode;
    }

    public String getReasonForService() {
        return reasonForService;
    }

    public String getDisplayName() {
        return displayName;
    }
}
