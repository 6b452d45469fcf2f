package com.anthem.rxadj.dur.checks;

import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.drug.GpiCodes;
import com.anthem.rxadj.dur.DurAlert;
import com.anthem.rxadj.dur.DurAlertType;
import com.anthem.rxadj.dur.DurContext;
import com.anthem.rxadj.dur.DuplicationClass;
import com.anthem.rxadj.model.CurrentMedication;
import com.anthem.rxadj.rules.RuleTables;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flags a new drug that falls in the same therapeutic class as a different product
 * the member already takes.
 */
@Component
public class TherapeuticDuplicationCheck implements DurCheck {

    @Override
    public List<DurAlert> check(DurContext context, RuleTables tables) {
        DrugIdentifier drug = context.getClaim().getDrug();
        List<DuplicationClass> classes = tables.duplicationClasses().matchGpi(drug.getGpi());
        if (classes.isEmpty()) {
            return List.of();
        }

        List<DurAlert> alerts = new ArrayList<>();
        for (DuplicationClass duplication : classes) {
            List<CurrentMedication> sameClass = new ArrayList<>();
            for (CurrentMedication med : context.getMember().getCurrentMedications()) {
                if (GpiCodes.isUnder(med.getGpi(), duplication.getGpiClass())
                        && !Objects.equals(med.getNdc(), drug.getNdc())) {
                    sameClass.add(med);
                }
            }
            if (sameClass.size() < duplication.getMaxConcurrent()) {
                continue;
            }
            for (CurrentMedication existing : sameClass) {
                alerts.add(DurAlert.builder()
                        .alertType(DurAlertType.THERAPEUTIC_DUPLICATION)
                        .clinicalSignificance(duplication.getSignificance())
                        .ruleId(duplication.getDuplicationId())
                        .drug1Ndc(drug.getNdc())
                        .drug1Name(drug.displayName())
                        .drug1Gpi(drug.getGpi())
                        .drug2Ndc(existing.getNdc())
                        .drug2Name(existing.getName())
                        .drug2Gpi(existing.getGpi())
                        .message("Therapeutic duplication: " + duplication.getClassName())
                        .recommendation("Maximum " + duplication.getMaxConcurrent() + " concurrent")
                        .reasonForService(DurAlertType.THERAPEUTIC_DUPLICATION.getReasonForService())
                        .build());
            }
        }
        return alerts;
    }

    @Override
    public String getName() {
        return "THERAPEUTIC_DUPLICATION";
    }

    @Override
    public int getPriority() {
        return 90;
    }
}
