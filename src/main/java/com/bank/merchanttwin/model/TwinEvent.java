package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One attempted action observed by the twin, as fed to the failure-rate monitor.
 */
@Value
@Builder
public class TwinEvent {
    String merchantId;
    ActionKey actionKey;
    Outcome outcome;
    Instant occurredAt;

    public boolean isFailure() {
        return outcome == Outcome.FAIL;
    }
}
