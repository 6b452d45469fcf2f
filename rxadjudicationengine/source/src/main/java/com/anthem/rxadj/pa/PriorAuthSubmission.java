package com.anthem.rxadj.pa;

import com.anthem.rxadj.drug.DrugIdentifier;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Prescriber's prior authorization submission, before an id is assigned.
 */
@Value
@Builder
public class PriorAuthSubmission {

    String memberId;
    String cardholderId;
    DrugIdentifier drug;
    BigDecimal quantityRequested;
    int daysSupplyRequested;

    String prescriberNpi;
    String prescriberName;
    String prescriberSpecialty;

    @Singular
    List<String> diagnosisCodes;

    @Singular
    List<String> previousTherapies;

    @Singular
    Map<String, BigDecimal> labResults;

    Integer memberAge;

    @Builder.Default
    Urgency urgency = Urgency.ROUTINE;

    @Builder.Default
    PriorAuthRequestType requestType = PriorAuthRequestType.INITIAL;
}
