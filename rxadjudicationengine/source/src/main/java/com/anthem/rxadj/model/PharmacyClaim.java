package com.anthem.rxadj.model;

import com.anthem.rxadj.drug.DrugIdentifier;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Pharmacy claim (or claim-like request) submitted for adjudication.
 */
@Value
@Builder
public class PharmacyClaim {

    String claimId;
    String memberId;
    DrugIdentifier drug;
    BigDecimal quantity;
    int daysSupply;
    LocalDate serviceDate;
    String prescriberNpi;

    /** Authorization number supplied with the claim, if any */
    String priorAuthNumber;
}
