package com.anthem.rxadj.dur.checks;

import com.anthem.rxadj.dur.DurAlert;
import com.anthem.rxadj.dur.DurContext;
import com.anthem.rxadj.rules.RuleTables;

import java.util.List;

/**
 * Interface for pluggable DUR checks.
 * Implementations are stateless and safe to run concurrently.
 */
public interface DurCheck {

    /**
     * Run the check against one claim.
     *
     * @return alerts raised, empty when the claim is clean
     */
    List<DurAlert> check(DurContext context, RuleTables tables);

    /**
     * Get the check name.
     */
    String getName();

    /**
     * Get the check priority (higher = runs first).
     */
    default int getPriority() {
        return 0;
    }
}
