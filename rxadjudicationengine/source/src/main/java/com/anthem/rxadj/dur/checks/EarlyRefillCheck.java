package com.anthem.rxadj.dur.checks;

import com.anthem.rxadj.config.RxAdjudicationProperties;
import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.dur.ClinicalSignificance;
import com.anthem.rxadj.dur.DurAlert;
import com.anthem.rxadj.dur.DurAlertType;
import com.anthem.rxadj.dur.DurContext;
import com.anthem.rxadj.exception.InvalidRequestException;
import com.anthem.rxadj.history.ClaimHistoryEntry;
import com.anthem.rxadj.model.CurrentMedication;
import com.anthem.rxadj.rules.RuleTables;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Flags a fill submitted before the previous supply of the same NDC should run out.
 */
@Component
public class EarlyRefillCheck implements DurCheck {

    private final RxAdjudicationProperties properties;

    public EarlyRefillCheck(RxAdjudicationProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<DurAlert> check(DurContext context, RuleTables tables) {
        DrugIdentifier drug = context.getClaim().getDrug();
        LocalDate serviceDate = context.getClaim().getServiceDate();
        if (serviceDate == null) {
            throw new InvalidRequestException("serviceDate", "Service date is required for early refill review");
        }
        if (!drug.hasNdc()) {
            return List.of();
        }

        PreviousFill lastFill = findLastFill(drug.getNdc(), serviceDate, context);
        if (lastFill == null) {
            return List.of();
        }

        LocalDate expectedExhaustion = lastFill.serviceDate().plusDays(lastFill.daysSupply());
        long daysEarly = ChronoUnit.DAYS.between(serviceDate, expectedExhaustion);
        int toleranceDays = (int) Math.floor(lastFill.daysSupply() * properties.getDur().getEarlyRefillTolerancePercent() / 100.0);

        if (daysEarly <= 0 || daysEarly <= toleranceDays) {
            return List.of();
        }

        return List.of(DurAlert.builder()
                .alertType(DurAlertType.EARLY_REFILL)
                .clinicalSignificance(ClinicalSignificance.LEVEL_3)
                .ruleId("EARLY-REFILL")
                .drug1Ndc(drug.getNdc())
                .drug1Name(drug.displayName())
                .drug1Gpi(drug.getGpi())
                .message("Refill " + daysEarly + " days early; previous " + lastFill.daysSupply()
                        + "-day supply runs out " + expectedExhaustion)
                .recommendation("Wait until medication supply is lower")
                .reasonForService(DurAlertType.EARLY_REFILL.getReasonForService())
                .daysEarly((int) daysEarly)
                .previousFillDate(lastFill.serviceDate())
                .build());
    }

    private PreviousFill findLastFill(String ndc, LocalDate serviceDate, DurContext context) {
        PreviousFill last = null;
        if (context.getHistory() != null) {
            for (ClaimHistoryEntry entry : context.getHistory()) {
                if (ndc.equals(entry.getNdc())) {
                    last = later(last, entry.getServiceDate(), entry.getDaysSupply(), serviceDate);
                }
            }
        }
        for (CurrentMedication med : context.getMember().getCurrentMedications()) {
            if (ndc.equals(med.getNdc())) {
                last = later(last, med.getServiceDate(), med.getDaysSupply(), serviceDate);
            }
        }
        return last;
    }

    private PreviousFill later(PreviousFill current, LocalDate fillDate, int daysSupply, LocalDate serviceDate) {
        // fills dated after the claim are not prior fills
        if (fillDate == null || fillDate.isAfter(serviceDate)) {
            return current;
        }
        if (current == null
                || fillDate.isAfter(current.serviceDate())
                || (fillDate.equals(current.serviceDate()) && daysSupply > current.daysSupply())) {
            return new PreviousFill(fillDate, daysSupply);
        }
        return current;
    }

    @Override
    public String getName() {
        return "EARLY_REFILL";
    }

    @Override
    public int getPriority() {
        return 80;
    }

    private record PreviousFill(LocalDate serviceDate, int daysSupply) {
    }
}
