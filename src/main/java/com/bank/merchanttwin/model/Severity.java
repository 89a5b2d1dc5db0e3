package com.bank.merchanttwin.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Impact tier of a failing or warning rule. {@link #rank()} orders tiers for
 * the scanner: higher rank sorts first.
 */
public enum Severity {
    CRITICAL("critical", 4),
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String value;
    private final int rank;

    Severity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }
}
