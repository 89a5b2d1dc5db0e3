package com.bank.merchanttwin.reasoning;

import com.bank.merchanttwin.model.ActionKey;
import com.bank.merchanttwin.model.EvaluationResult;
import com.bank.merchanttwin.model.Failure;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.RiskTier;
import com.bank.merchanttwin.model.SensorHealth;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the reasoning collaborator receives about one merchant. The
 * collaborator's reply is free text and is never read back.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagnosticPayload {
    Merchant merchant;
    Map<String, Object> sensors;
    SensorHealth sensorHealth;
    RiskTier riskTier;
    List<Failure> failures;
    ActionKey actionKey;            // set when the merchant just attempted an action
    EvaluationResult lastResult;
}
