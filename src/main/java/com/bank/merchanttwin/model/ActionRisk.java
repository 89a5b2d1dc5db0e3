package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the demand x failure-rate matrix: how often an action would fail
 * across the fleet, weighted by how many calls that action historically drives.
 */
@Value
@Builder
public class ActionRisk {
    ActionKey actionKey;
    String label;
    int demandRank;
    long demandTotal;
    int failingMerchants;
    double failureRatePct;
    double riskScore;
}
