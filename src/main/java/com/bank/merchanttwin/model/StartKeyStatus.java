package com.bank.merchanttwin.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StartKeyStatus {
    VALID("valid"),
    INVALID("invalid"),
    EXPIRED("expired");

    private final String value;

    StartKeyStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
