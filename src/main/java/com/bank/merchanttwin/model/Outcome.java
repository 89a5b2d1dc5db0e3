package com.bank.merchanttwin.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict of one rule against one merchant. Serialized the way downstream
 * consumers expect it: {@code true}, {@code "warn"} or {@code false}.
 */
public enum Outcome {
    PASS,
    WARN,
    FAIL;

    @JsonValue
    public Object wireValue() {
        switch (this) {
            case PASS:
                return Boolean.TRUE;
            case WARN:
                return "warn";
            default:
                return Boolean.FALSE;
        }
    }
}
