package com.bank.merchanttwin.service;

import com.bank.merchanttwin.config.MetricsConfig;
import com.bank.merchanttwin.config.TwinProperties;
import com.bank.merchanttwin.engine.DefaultRuleCatalog;
import com.bank.merchanttwin.engine.FleetScanner;
import com.bank.merchanttwin.engine.RuleEngine;
import com.bank.merchanttwin.exception.InvalidMerchantStateException;
import com.bank.merchanttwin.model.BatchResult;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.RiskTier;
import com.bank.merchanttwin.seeder.MerchantRegistry;
import com.bank.merchanttwin.testutil.TestMerchants;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FleetScanServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private FleetScanService service;
    private List<Merchant> registryFleet;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        RuleEngine ruleEngine = new RuleEngine(DefaultRuleCatalog.create());
        service = new FleetScanService(
                new FleetScanner(ruleEngine, new TwinProperties()),
                new RiskClassificationService(),
                new MetricsConfig(meterRegistry),
                Tracer.NOOP);
        registryFleet = new MerchantRegistry().merchants();
    }

    @Test
    void scan_registryFleet_returnsScannerResult() {
        BatchResult result = service.scan(registryFleet);

        assertThat(result.getFleet().getTotalMerchants()).isEqualTo(5);
        assertThat(result.getFleet().getHealthyMerchants()).isEqualTo(2);
        assertThat(result.getMerchantResults()).extracting(r -> r.getMerchant().getId())
                .containsExactly("M001", "M002", "M003", "M004", "M005");
    }

    @Test
    void scan_recordsMerchantFailureAndTierMetrics() {
        service.scan(registryFleet);

        assertThat(meterRegistry.get("twin.scan.merchants").counter().count()).isEqualTo(5.0);
        // M002 is suspended: settlement, PIN change and SIM swap all block on it
        assertThat(meterRegistry.get("twin.failure.count")
                .tag("code", "ACC_SUSPENDED").tag("severity", "critical")
                .counter().count()).isEqualTo(3.0);
        assertThat(meterRegistry.get("twin.merchant.risk_tier").tag("tier", "CRITICAL")
                .counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("twin.scan.calls_at_risk").summary().count()).isEqualTo(5);
    }

    @Test
    void scan_emptyFleet_recordsNothingButSucceeds() {
        BatchResult result = service.scan(List.of());

        assertThat(result.getFleet().getTotalMerchants()).isZero();
        assertThat(meterRegistry.get("twin.scan.merchants").counter().count()).isZero();
        assertThat(meterRegistry.find("twin.failure.count").counter()).isNull();
    }

    @Test
    void scan_corruptSnapshot_propagates() {
        Merchant corrupt = TestMerchants.healthy("BAD-3").toBuilder().balance(-50).build();

        assertThatThrownBy(() -> service.scan(List.of(TestMerchants.healthy("T1"), corrupt)))
                .isInstanceOf(InvalidMerchantStateException.class)
                .hasMessageContaining("BAD-3");
        assertThat(meterRegistry.get("twin.scan.merchants").counter().count()).isZero();
    }

    @Test
    void tierBreakdown_registryFleet_everyTierPresent() {
        Map<RiskTier, Integer> tiers = service.tierBreakdown(registryFleet);

        assertThat(tiers).containsEntry(RiskTier.CRITICAL, 2)
                .containsEntry(RiskTier.HIGH, 0)
                .containsEntry(RiskTier.MEDIUM, 1)
                .containsEntry(RiskTier.HEALTHY, 2);
    }
}
