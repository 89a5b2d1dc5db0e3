package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FleetStats {
    int totalMerchants;
    int healthyMerchants;
    int merchantsWithAnyFailure;
    int merchantsWithCritical;
    long totalCallsAtRisk;
    List<FailureCodeCount> topFailures;
}
