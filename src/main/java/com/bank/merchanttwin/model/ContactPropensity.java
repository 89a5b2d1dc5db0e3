package com.bank.merchanttwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Likelihood (0-100) that a merchant contacts the call centre within 7 days.
 */
@Value
@Builder
public class ContactPropensity {
    String merchantId;
    int score;
    PropensityTier tier;
    List<String> factors;
}
