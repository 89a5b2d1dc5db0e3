package com.bank.merchanttwin.exception;

/**
 * Raised when an action key is not one of the twelve catalog actions.
 * Always a caller bug; never retried.
 */
public class UnknownActionException extends RuntimeException {

    private final String actionKey;

    public UnknownActionException(String actionKey) {
        super("Unknown action key: " + actionKey);
        this.actionKey = actionKey;
    }

    public String getActionKey() {
        return actionKey;
    }
}
