package com.bank.merchanttwin.model;

public enum RiskTier {
    CRITICAL,
    HIGH,
    MEDIUM,
    HEALTHY;

    /**
     * Coarse tier from traffic-light counts. A frozen account is always CRITICAL.
     */
    public static RiskTier fromSensorCounts(int red, int amber, boolean frozen) {
        if (red >= 3 || frozen) return CRITICAL;
        if (red >= 1 || amber >= 3) return HIGH;
        if (amber >= 1) return MEDIUM;
        return HEALTHY;
    }
}
