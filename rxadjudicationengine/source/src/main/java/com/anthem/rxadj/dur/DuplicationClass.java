package com.anthem.rxadj.dur;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Therapeutic class in which concurrent products duplicate each other.
 * The length of {@code gpiClass} sets the class granularity.
 */
@Value
@Builder
@Jacksonized
public class DuplicationClass {

    String duplicationId;
    String gpiClass;
    String className;

    @Builder.Default
    int maxConcurrent = 1;

    @Builder.Default
    ClinicalSignificance significance = ClinicalSignificance.LEVEL_2;
}
