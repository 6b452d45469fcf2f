package com.anthem.rxadj.dur;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats DUR alerts for display to pharmacists and in adjudication messages.
 */
@Component
public class DurAlertFormatter {

    public String formatForDisplay(DurAlert alert) {
        List<String> lines = new ArrayList<>();
        lines.add("[" + alert.getClinicalSignificance().getLabel() + "] " + alert.getAlertType().getDisplayName());
        lines.add("  Drug: " + alert.getDrug1Name());
        if (alert.getDrug2Name() != null) {
            lines.add("  Interacting Drug: " + alert.getDrug2Name());
        }
        lines.add("  Message: " + alert.getMessage());
        if (alert.getRecommendation() != null) {
            lines.add("  Recommendation: " + alert.getRecommendation());
        }
        if (alert.getDaysEarly() != null) {
            lines.add("  Days Early: " + alert.getDaysEarly());
        }
        return String.join("\n", lines);
    }

    /**
     * One-line form used in adjudication result messages.
     */
    public String formatSummaryLine(DurAlert alert) {
        return String.format("%s %s (%s): %s",
                alert.getAlertType().getConflictCode(),
                alert.getClinicalSignificance().getLabel(),
                alert.getRuleId(),
                alert.getMessage());
    }
}
