package com.anthem.rxadj.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Medication the member is currently taking (active within the plan's lookback).
 */
@Value
@Builder
public class CurrentMedication {

    String ndc;
    String gpi;
    String name;
    LocalDate serviceDate;
    int daysSupply;
    BigDecimal quantity;
}
