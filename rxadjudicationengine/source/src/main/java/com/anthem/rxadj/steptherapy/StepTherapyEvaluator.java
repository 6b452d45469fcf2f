package com.anthem.rxadj.steptherapy;

import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.drug.GpiCodes;
import com.anthem.rxadj.exception.InvalidRequestException;
import com.anthem.rxadj.history.ClaimHistoryEntry;
import com.anthem.rxadj.rules.RuleTables;
import com.anthem.rxadj.rules.RuleTablesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Checks a member's claim history against the step therapy protocol governing a drug.
 *
 * <p>Steps are checked in step number order and checking stops at the first step without
 * qualifying fills. Only fills dated within the protocol's lookback window, up to and
 * including the service date, count.
 */
@Service
public class StepTherapyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(StepTherapyEvaluator.class);

    private final RuleTablesRepository ruleTablesRepository;

    public StepTherapyEvaluator(RuleTablesRepository ruleTablesRepository) {
        this.ruleTablesRepository = ruleTablesRepository;
    }

    public Optional<StepTherapyProtocol> findProtocol(RuleTables tables, DrugIdentifier drug) {
        return tables.stepTherapyProtocols().match(drug).stream().findFirst();
    }

    /**
     * @return the result for the governing protocol, or empty when no protocol applies to the drug
     */
    public Optional<StepTherapyResult> check(DrugIdentifier drug, List<ClaimHistoryEntry> claimHistory,
                                             LocalDate serviceDate) {
        return check(ruleTablesRepository.current(), drug, claimHistory, serviceDate);
    }

    public Optional<StepTherapyResult> check(RuleTables tables, DrugIdentifier drug,
                                             List<ClaimHistoryEntry> claimHistory, LocalDate serviceDate) {
        if (drug == null || (!drug.hasNdc() && !drug.hasGpi())) {
            throw new InvalidRequestException("drug", "Drug identifier with an NDC or GPI is required");
        }
        return findProtocol(tables, drug).map(protocol -> evaluate(protocol, claimHistory, serviceDate));
    }

    public StepTherapyResult evaluate(StepTherapyProtocol protocol, List<ClaimHistoryEntry> claimHistory,
                                      LocalDate serviceDate) {
        if (claimHistory == null) {
            throw new InvalidRequestException("claimHistory", "Claim history is required (use an empty list when the member has none)");
        }
        if (serviceDate == null) {
            throw new InvalidRequestException("serviceDate", "Service date is required for step therapy");
        }

        LocalDate lookbackStart = serviceDate.minusDays(protocol.getLookbackDays());
        List<ClaimHistoryEntry> window = new ArrayList<>();
        for (ClaimHistoryEntry entry : claimHistory) {
            LocalDate filled = entry == null ? null : entry.getServiceDate();
            if (filled != null && !filled.isBefore(lookbackStart) && !filled.isAfter(serviceDate)) {
                window.add(entry);
            }
        }

        List<StepTherapyStep> steps = new ArrayList<>(protocol.getSteps());
        steps.sort(Comparator.comparingInt(StepTherapyStep::getStepNumber));

        StepTherapyResult.StepTherapyResultBuilder result = StepTherapyResult.builder()
                .protocolId(protocol.getProtocolId());
        for (StepTherapyStep step : steps) {
            if (!stepSatisfied(step, window)) {
                log.debug("Step therapy not satisfied: protocol={}, step={}, fillsInWindow={}",
                        protocol.getProtocolId(), step.getStepNumber(), window.size());
                return result
                        .satisfied(false)
                        .failedStep(step.getStepNumber())
                        .requiredDrugs(step.getRequiredDrugs())
                        .message("Step therapy not satisfied: " + step.getStepName() + " required. Try one of: "
                                + String.join(", ", step.getRequiredDrugs()))
                        .build();
            }
            result.completedStep(step.getStepNumber());
        }
        return result
                .satisfied(true)
                .message("Step therapy requirements satisfied")
                .build();
    }

    private boolean stepSatisfied(StepTherapyStep step, List<ClaimHistoryEntry> window) {
        for (String required : step.getRequiredDrugs()) {
            int fills = 0;
            int days = 0;
            for (ClaimHistoryEntry entry : window) {
                if (required.equals(entry.getNdc()) || GpiCodes.isUnder(entry.getGpi(), required)) {
                    fills++;
                    days += entry.getDaysSupply();
                }
            }
            if (fills >= step.getMinimumFills() && days >= step.getMinimumDays()) {
                return true;
            }
        }
        return false;
    }
}
