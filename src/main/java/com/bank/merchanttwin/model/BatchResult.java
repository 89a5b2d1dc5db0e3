package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchResult {
    List<MerchantScanResult> merchantResults;   // ordered by merchant id
    FleetStats fleet;
    List<ActionRisk> actionRisk;
}
