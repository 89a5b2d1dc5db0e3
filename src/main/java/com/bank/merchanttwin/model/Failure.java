package com.bank.merchanttwin.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * A non-passing evaluation annotated with its rule's display and demand metadata.
 */
@Value
@Builder
public class Failure {

    /**
     * Severity first, then historical demand descending, then demand rank ascending.
     */
    public static final Comparator<Failure> RISK_ORDER = Comparator
            .comparingInt((Failure f) -> f.getResult().getSeverity().rank()).reversed()
            .thenComparing(Comparator.comparingLong(Failure::getDemandTotal).reversed())
            .thenComparingInt(Failure::getDemandRank);

    String actionLabel;
    int demandRank;
    long demandTotal;
    String menuPath;
    String ussdPath;
    @JsonUnwrapped
    EvaluationResult result;

    @JsonIgnore
    public ActionKey getActionKey() {
        return result.getActionKey();
    }

    @JsonIgnore
    public String getCode() {
        return result.getCode();
    }

    @JsonIgnore
    public Severity getSeverity() {
        return result.getSeverity();
    }
}
