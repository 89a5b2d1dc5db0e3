package com.bank.merchanttwin.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SimStatus {
    ACTIVE("active"),
    SWAPPED("swapped"),
    UNREGISTERED("unregistered");

    private final String value;

    SimStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
