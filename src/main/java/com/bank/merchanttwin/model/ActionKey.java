package com.bank.merchanttwin.model;

import com.bank.merchanttwin.exception.UnknownActionException;

/**
 * The twelve customer-facing actions the twin diagnoses, in demand-rank order.
 */
public enum ActionKey {
    SETTLE_FUNDS,
    PIN_PUK,
    SIM_SWAP,
    ACCOUNT_STATUS,
    START_KEY,
    STATEMENT,
    KYC_CHANGE,
    NOTIFICATIONS,
    BALANCE,
    DORMANT_OP,
    PIN_UNLOCK,
    APPLICATION;

    public static ActionKey fromKey(String key) {
        if (key != null) {
            for (ActionKey action : values()) {
                if (action.name().equals(key)) {
                    return action;
                }
            }
        }
        throw new UnknownActionException(key);
    }
}
