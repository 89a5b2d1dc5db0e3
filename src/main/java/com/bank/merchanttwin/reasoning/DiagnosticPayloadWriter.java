package com.bank.merchanttwin.reasoning;

import com.bank.merchanttwin.engine.RuleEngine;
import com.bank.merchanttwin.model.ActionKey;
import com.bank.merchanttwin.model.EvaluationResult;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.SensorHealth;
import com.bank.merchanttwin.model.SensorSchema;
import com.bank.merchanttwin.service.RiskClassificationService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Assembles and serializes the hand-off payload for the reasoning collaborator.
 */
@Component
public class DiagnosticPayloadWriter {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticPayloadWriter.class);

    private final RuleEngine ruleEngine;
    private final RiskClassificationService riskClassificationService;
    private final ObjectMapper objectMapper;

    public DiagnosticPayloadWriter(RuleEngine ruleEngine, RiskClassificationService riskClassificationService) {
        this.ruleEngine = ruleEngine;
        this.riskClassificationService = riskClassificationService;
        this.objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public DiagnosticPayload build(Merchant merchant) {
        return build(merchant, null, null);
    }

    /**
     * @param actionKey  the action the merchant just attempted, or null
     * @param lastResult its evaluation, or null
     */
    public DiagnosticPayload build(Merchant merchant, ActionKey actionKey, EvaluationResult lastResult) {
        SensorHealth health = riskClassificationService.sensorHealth(merchant);
        return DiagnosticPayload.builder()
                .merchant(merchant)
                .sensors(SensorSchema.sensorValues(merchant))
                .sensorHealth(health)
                .riskTier(riskClassificationService.riskTier(merchant))
                .failures(ruleEngine.scanAll(merchant))
                .actionKey(actionKey)
                .lastResult(lastResult)
                .build();
    }

    public String toJson(DiagnosticPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            String merchantId = payload.getMerchant() != null ? payload.getMerchant().getId() : null;
            log.error("Failed to serialize diagnostic payload for merchant {}", merchantId, e);
            throw new IllegalStateException("Diagnostic payload for merchant " + merchantId + " is not serializable", e);
        }
    }
}
