package com.anthem.rxadj.dur.checks;

import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.dur.DurAlert;
import com.anthem.rxadj.dur.DurAlertType;
import com.anthem.rxadj.dur.DurContext;
import com.anthem.rxadj.dur.GenderRestriction;
import com.anthem.rxadj.exception.InvalidRequestException;
import com.anthem.rxadj.model.Gender;
import com.anthem.rxadj.rules.RuleTables;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags drugs indicated for one gender dispensed to a member of another.
 */
@Component
public class GenderRestrictionCheck implements DurCheck {

    @Override
    public List<DurAlert> check(DurContext context, RuleTables tables) {
        DrugIdentifier drug = context.getClaim().getDrug();
        List<GenderRestriction> restrictions = tables.genderRestrictions().matchGpi(drug.getGpi());
        if (restrictions.isEmpty()) {
            return List.of();
        }

        Gender gender = context.getMember().getGender();
        if (gender == null) {
            throw new InvalidRequestException("member.gender",
                    "Member gender is required: " + drug.displayName() + " has a gender restriction");
        }

        List<DurAlert> alerts = new ArrayList<>();
        for (GenderRestriction restriction : restrictions) {
            if (restriction.getAllowedGender() == gender) {
                continue;
            }
            alerts.add(DurAlert.builder()
                    .alertType(DurAlertType.DRUG_GENDER)
                    .clinicalSignificance(restriction.getSignificance())
                    .ruleId(restriction.getRestrictionId())
                    .drug1Ndc(drug.getNdc())
                    .drug1Name(drug.displayName())
                    .drug1Gpi(drug.getGpi())
                    .message(restriction.getMessage())
                    .recommendation("Drug intended for gender: " + restriction.getAllowedGender())
                    .reasonForService(DurAlertType.DRUG_GENDER.getReasonForService())
                    .build());
        }
        return alerts;
    }

    @Override
    public String getName() {
        return "GENDER_RESTRICTION";
    }

    @Override
    public int getPriority() {
        return 60;
    }
}
