package com.anthem.rxadj.pa;

import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.model.MemberClinicalContext;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class PriorAuthRequest {

    String paRequestId;
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
    Urgency urgency;
    PriorAuthRequestType requestType;
    LocalDateTime requestDate;

    /**
     * Clinical context carried by the request, used for criteria review.
     */
    public MemberClinicalContext toClinicalContext() {
        return MemberClinicalContext.builder()
                .memberId(memberId)
                .age(memberAge)
                .diagnosisCodes(diagnosisCodes)
                .priorTherapies(previousTherapies)
                .labResults(labResults)
                .prescriberSpecialty(prescriberSpecialty)
                .build();
    }
}
