package com.bank.merchanttwin.config;

import com.bank.merchanttwin.model.RiskTier;
import com.bank.merchanttwin.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final Counter merchantsScanned;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.merchantsScanned = Counter.builder("twin.scan.merchants")
                .description("Merchant snapshots run through a fleet scan")
                .register(registry);
    }

    public void recordMerchantsScanned(int count) {
        merchantsScanned.increment(count);
    }

    public void recordFailure(String code, Severity severity) {
        Counter.builder("twin.failure.count")
                .tag("code", code)
                .tag("severity", severity.value())
                .register(registry)
                .increment();
    }

    public void recordRiskTier(RiskTier tier) {
        Counter.builder("twin.merchant.risk_tier")
                .tag("tier", tier.name())
                .register(registry)
                .increment();
    }

    public void recordCallsAtRisk(long callsAtRisk) {
        DistributionSummary.builder("twin.scan.calls_at_risk")
                .register(registry)
                .record(callsAtRisk);
    }
}
