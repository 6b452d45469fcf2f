package com.anthem.rxadj.dur;

import com.anthem.rxadj.dur.checks.DurCheck;
import com.anthem.rxadj.exception.InvalidRequestException;
import com.anthem.rxadj.rules.RuleTables;
import com.anthem.rxadj.rules.RuleTablesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * DUR Rules Engine.
 * Runs every registered check against a claim and collects the alerts. Checks are
 * independent; one check firing never stops the others.
 */
@Service
public class DurRulesEngine {

    private static final Logger log = LoggerFactory.getLogger(DurRulesEngine.class);

    private final List<DurCheck> checks;
    private final RuleTablesRepository ruleTablesRepository;

    public DurRulesEngine(List<DurCheck> checks, RuleTablesRepository ruleTablesRepository) {
        List<DurCheck> ordered = new ArrayList<>(checks);
        ordered.sort(Comparator.comparingInt(DurCheck::getPriority).reversed());
        this.checks = List.copyOf(ordered);
        this.ruleTablesRepository = ruleTablesRepository;
    }

    public List<DurAlert> run(DurContext context) {
        return run(context, ruleTablesRepository.current());
    }

    /**
     * Run all checks against one rule snapshot.
     */
    public List<DurAlert> run(DurContext context, RuleTables tables) {
        validateContext(context);
        List<DurAlert> alerts = new ArrayList<>();
        for (DurCheck check : checks) {
            List<DurAlert> found = check.check(context, tables);
            if (!found.isEmpty()) {
                log.debug("DUR check fired: check={}, claimId={}, alerts={}",
                        check.getName(), context.getClaim().getClaimId(), found.size());
                alerts.addAll(found);
            }
        }
        return alerts;
    }

    public List<String> getCheckNames() {
        return checks.stream().map(DurCheck::getName).toList();
    }

    private void validateContext(DurContext context) {
        if (context == null || context.getClaim() == null) {
            throw new InvalidRequestException("claim", "Claim is required for DUR review");
        }
        if (context.getClaim().getDrug() == null) {
            throw new InvalidRequestException("claim.drug", "Claim drug is required for DUR review");
        }
        if (context.getMember() == null) {
            throw new InvalidRequestException("member", "Member clinical context is required for DUR review");
        }
    }
}
