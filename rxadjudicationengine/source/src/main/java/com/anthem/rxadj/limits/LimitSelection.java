package com.anthem.rxadj.limits;

import java.util.List;
import java.util.Optional;

/**
 * Reduces per-limit results to the single governing result.
 *
 * <p>Pass one returns the first failure in configuration order. Pass two folds over the
 * passing results keeping the smallest allowed quantity, with ties going to the earlier
 * result.
 */
public final class LimitSelection {

    private LimitSelection() {
    }

    public static Optional<QuantityLimitResult> select(List<QuantityLimitResult> results) {
        Optional<QuantityLimitResult> firstFailure = firstFailure(results);
        if (firstFailure.isPresent()) {
            return firstFailure;
        }
        return mostRestrictive(results);
    }

    static Optional<QuantityLimitResult> firstFailure(List<QuantityLimitResult> results) {
        for (QuantityLimitResult result : results) {
            if (!result.isPassed()) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    static Optional<QuantityLimitResult> mostRestrictive(List<QuantityLimitResult> results) {
        QuantityLimitResult selected = null;
        for (QuantityLimitResult result : results) {
            if (selected == null || result.getAllowedQuantity().compareTo(selected.getAllowedQuantity()) < 0) {
                selected = result;
            }
        }
        return Optional.ofNullable(selected);
    }
}
