package com.anthem.rxadj.dur.checks;

import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.dur.AgeRestriction;
import com.anthem.rxadj.dur.DurAlert;
import com.anthem.rxadj.dur.DurAlertType;
import com.anthem.rxadj.dur.DurContext;
import com.anthem.rxadj.exception.InvalidRequestException;
import com.anthem.rxadj.rules.RuleTables;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags drugs given outside their configured age range.
 * Drugs with no configured range are unrestricted.
 */
@Component
public class AgeRestrictionCheck implements DurCheck {

    @Override
    public List<DurAlert> check(DurContext context, RuleTables tables) {
        DrugIdentifier drug = context.getClaim().getDrug();
        List<AgeRestriction> restrictions = tables.ageRestrictions().matchGpi(drug.getGpi());
        if (restrictions.isEmpty()) {
            return List.of();
        }

        Integer age = context.getMember().ageOn(context.getClaim().getServiceDate());
        if (age == null) {
            throw new InvalidRequestException("member.age",
                    "Member age or date of birth is required: " + drug.displayName() + " has an age restriction");
        }

        List<DurAlert> alerts = new ArrayList<>();
        for (AgeRestriction restriction : restrictions) {
            if (!restriction.excludes(age)) {
                continue;
            }
            alerts.add(DurAlert.builder()
                    .alertType(DurAlertType.DRUG_AGE)
                    .clinicalSignificance(restriction.getSignificance())
                    .ruleId(restriction.getRestrictionId())
                    .drug1Ndc(drug.getNdc())
                    .drug1Name(drug.displayName())
                    .drug1Gpi(drug.getGpi())
                    .message(restriction.getMessage())
                    .recommendation(String.format("Patient age %d outside range %d-%s", age,
                            restriction.getMinAge() == null ? 0 : restriction.getMinAge(),
                            restriction.getMaxAge() == null ? "unlimited" : restriction.getMaxAge().toString()))
                    .reasonForService(DurAlertType.DRUG_AGE.getReasonForService())
                    .build());
        }
        return alerts;
    }

    @Override
    public String getName() {
        return "AGE_RESTRICTION";
    }

    @Override
    public int getPriority() {
        return 70;
    }
}
