package com.anthem.rxadj.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the adjudication engine. Invalid values fail startup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "rxadj")
public class RxAdjudicationProperties {

    @Valid
    private Rules rules = new Rules();

    @Valid
    private Dur dur = new Dur();

    @Valid
    private PriorAuth priorAuth = new PriorAuth();

    @Data
    public static class Rules {
        /** Spring resource location of the rule tables JSON */
        @NotBlank
        private String location = "classpath:rules/default-rule-tables.json";

        /** Reject limits that carry no maximum instead of skipping them */
        private boolean strictValidation = true;
    }

    @Data
    public static class Dur {
        /** Share of the previous days supply a refill may come early without an alert */
        @PositiveOrZero
        private double earlyRefillTolerancePercent = 0;
    }

    @Data
    public static class PriorAuth {
        @Positive
        private int appealWindowDays = 60;
        @PositiveOrZero
        private int defaultRefills = 12;
        @Positive
        private int approvalDurationDays = 365;
        @Positive
        private int emergencyDurationDays = 30;
        @PositiveOrZero
        private int partialRefills = 3;
        @Positive
        private int partialDurationDays = 90;
        /** Delay between sweeps that evict expired determinations */
        @Positive
        private long purgeIntervalMs = 3_600_000;
        private String appealInstructions =
                "Submit a written appeal with supporting clinical documentation before the appeal deadline.";
    }
}
