package com.anthem.rxadj.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Map;

/**
 * Clinical picture of the member used by DUR checks and prior authorization criteria.
 */
@Value
@Builder
public class MemberClinicalContext {

    String memberId;

    /** Age in whole years; when absent it is derived from the date of birth */
    Integer age;
    LocalDate dateOfBirth;
    Gender gender;

    /** ICD-10 codes */
    @Singular
    List<String> diagnosisCodes;

    /** Drug names or product codes previously tried */
    @Singular
    List<String> priorTherapies;

    /** Lab name to most recent value, e.g. "HbA1c" to 8.5 */
    @Singular
    Map<String, BigDecimal> labResults;

    String prescriberSpecialty;

    @Singular
    List<CurrentMedication> currentMedications;

    /**
     * Age on the given date, or null when neither age nor date of birth is known.
     */
    public Integer ageOn(LocalDate date) {
        if (age != null) {
            return age;
        }
        if (dateOfBirth == null || date == null) {
            return null;
        }
        return Period.between(dateOfBirth, date).getYears();
    }
}
