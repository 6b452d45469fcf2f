package com.anthem.rxadj.rules;

import com.anthem.rxadj.exception.RuleConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current rule snapshot. Readers take {@link #current()} once per evaluation;
 * reloads validate the replacement fully and then swap the reference.
 */
public class RuleTablesRepository {

    private static final Logger log = LoggerFactory.getLogger(RuleTablesRepository.class);

    private final AtomicReference<RuleTables> current;
    private final RuleTablesValidator validator;

    public RuleTablesRepository(RuleTables initial, RuleTablesValidator validator) {
        this.current = new AtomicReference<>(initial);
        this.validator = validator;
    }

    public RuleTables current() {
        return current.get();
    }

    /**
     * Replace the snapshot. When the definition is rejected the previous snapshot stays active.
     *
     * @return the snapshot now in effect
     * @throws RuleConfigurationException when the definition is malformed
     */
    public RuleTables reload(RuleTablesDefinition definition) {
        RuleTables replacement;
        try {
            replacement = validator.validateAndBuild(definition);
        } catch (RuleConfigurationException e) {
            log.error("Rule tables reload rejected, keeping version {}: {}", current().getVersion(), e.getMessage());
            throw e;
        }
        RuleTables previous = current.getAndSet(replacement);
        log.info("Rule tables reloaded: {} -> {} ({} quantity limits, {} interactions, {} criteria sets, {} step therapy protocols)",
                previous.getVersion(), replacement.getVersion(),
                replacement.getQuantityLimits().size(),
                replacement.getDrugInteractions().size(),
                replacement.getCriteriaSets().size(),
                replacement.getStepTherapyProtocols().size());
        return replacement;
    }
}
