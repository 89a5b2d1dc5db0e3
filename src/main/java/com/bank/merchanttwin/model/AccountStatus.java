package com.bank.merchanttwin.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AccountStatus {
    ACTIVE("active"),
    SUSPENDED("suspended"),
    FROZEN("frozen");

    private final String value;

    AccountStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
