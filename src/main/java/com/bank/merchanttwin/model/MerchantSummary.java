package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Pass/fail counts for one merchant. {@code failing} includes warnings, which
 * are also broken out in {@code warnings}.
 */
@Value
@Builder
public class MerchantSummary {
    int total;
    int passing;
    int failing;
    int warnings;
    Map<Severity, Integer> bySeverity;
    long callsAtRisk;

    public int countOf(Severity severity) {
        return bySeverity.getOrDefault(severity, 0);
    }
}
