package com.bank.merchanttwin.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum KycStatus {
    VERIFIED("verified"),
    PENDING("pending"),
    EXPIRED("expired");

    private final String value;

    KycStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
