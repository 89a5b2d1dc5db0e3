package com.bank.merchanttwin.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Verdict of evaluating one rule against one merchant snapshot.
 * On a pass the code is {@link #OK_CODE} and only {@code inline} is set.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationResult {

    public static final String OK_CODE = "OK";

    ActionKey actionKey;
    @JsonProperty("success")
    Outcome outcome;
    String code;
    Severity severity;
    String inline;
    String reason;
    String fix;
    String escalation;

    @JsonIgnore
    public boolean isPassing() {
        return outcome == Outcome.PASS;
    }
}
