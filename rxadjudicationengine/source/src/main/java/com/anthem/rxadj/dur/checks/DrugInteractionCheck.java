package com.anthem.rxadj.dur.checks;

import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.drug.GpiCodes;
import com.anthem.rxadj.dur.DurAlert;
import com.anthem.rxadj.dur.DurAlertType;
import com.anthem.rxadj.dur.DurContext;
import com.anthem.rxadj.dur.DrugInteraction;
import com.anthem.rxadj.model.CurrentMedication;
import com.anthem.rxadj.rules.RuleTables;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks the new drug against each current medication using the class-pair interaction table.
 * A pair matches in either direction.
 */
@Component
public class DrugInteractionCheck implements DurCheck {

    @Override
    public List<DurAlert> check(DurContext context, RuleTables tables) {
        DrugIdentifier drug = context.getClaim().getDrug();
        if (!drug.hasGpi()) {
            return List.of();
        }

        // interactions where the new drug sits on either side of the pair
        List<DrugInteraction> asDrug1 = tables.interactionsByDrug1().matchGpi(drug.getGpi());
        List<DrugInteraction> asDrug2 = tables.interactionsByDrug2().matchGpi(drug.getGpi());
        if (asDrug1.isEmpty() && asDrug2.isEmpty()) {
            return List.of();
        }

        List<DurAlert> alerts = new ArrayList<>();
        for (CurrentMedication med : context.getMember().getCurrentMedications()) {
            if (drug.hasNdc() && Objects.equals(drug.getNdc(), med.getNdc())) {
                continue;
            }
            Set<DrugInteraction> matched = new LinkedHashSet<>();
            for (DrugInteraction interaction : asDrug1) {
                if (GpiCodes.isUnder(med.getGpi(), interaction.getDrug2Gpi())) {
                    matched.add(interaction);
                }
            }
            for (DrugInteraction interaction : asDrug2) {
                if (GpiCodes.isUnder(med.getGpi(), interaction.getDrug1Gpi())) {
                    matched.add(interaction);
                }
            }
            for (DrugInteraction interaction : matched) {
                alerts.add(toAlert(drug, med, interaction));
            }
        }
        return alerts;
    }

    private DurAlert toAlert(DrugIdentifier drug, CurrentMedication med, DrugInteraction interaction) {
        return DurAlert.builder()
                .alertType(DurAlertType.DRUG_DRUG)
                .clinicalSignificance(interaction.getClinicalSignificance())
                .ruleId(interaction.getInteractionId())
                .drug1Ndc(drug.getNdc())
                .drug1Name(drug.displayName())
                .drug1Gpi(drug.getGpi())
                .drug2Ndc(med.getNdc())
                .drug2Name(med.getName())
                .drug2Gpi(med.getGpi())
                .message(interaction.getInteractionDescription())
                .recommendation(interaction.getRecommendation())
                .reasonForService(DurAlertType.DRUG_DRUG.getReasonForService())
                .build();
    }

    @Override
    public String getName() {
        return "DRUG_DRUG_INTERACTION";
    }

    @Override
    public int getPriority() {
        return 100;
    }
}
