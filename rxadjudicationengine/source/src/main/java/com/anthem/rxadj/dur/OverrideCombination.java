package com.anthem.rxadj.dur;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Result-of-service codes that may accompany one professional service code.
 */
@Value
@Builder
@Jacksonized
public class OverrideCombination {

    String professionalService;

    @Singular("resultOfService")
    List<String> resultsOfService;
}
