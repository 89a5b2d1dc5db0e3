package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FailureRateAnomaly {
    public static final String FAILURE_RATE_SPIKE = "FAILURE_RATE_SPIKE";

    String type;
    Severity severity;
    double zScore;
    double latestRate;
    double baselineRate;
    String message;
}
