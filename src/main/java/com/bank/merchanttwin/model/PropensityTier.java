package com.bank.merchanttwin.model;

public enum PropensityTier {
    VERY_HIGH,
    HIGH,
    MEDIUM,
    LOW;

    public static PropensityTier fromScore(int score) {
        if (score >= 70) return VERY_HIGH;
        if (score >= 50) return HIGH;
        if (score >= 30) return MEDIUM;
        return LOW;
    }
}
