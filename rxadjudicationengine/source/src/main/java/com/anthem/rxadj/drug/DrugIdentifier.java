package com.anthem.rxadj.drug;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Identifies a dispensed product by exact NDC and by its hierarchical GPI class code.
 * Each leading substring of the GPI names a broader therapeutic class.
 */
@Value
@Builder
@Jacksonized
public class DrugIdentifier {

    String ndc;
    String gpi;
    String name;

    public static DrugIdentifier of(String ndc, String gpi, String name) {
        return new DrugIdentifier(ndc, gpi, name);
    }

    public boolean hasGpi() {
        return gpi != null && !gpi.isEmpty();
    }

    public boolean hasNdc() {
        return ndc != null && !ndc.isEmpty();
    }

    /**
     * Label used in alert and limit messages.
     */
    public String displayName() {
        if (name != null && !name.isEmpty()) {
            return name;
        }
        return hasNdc() ? ndc : gpi;
    }
}
