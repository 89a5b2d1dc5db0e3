package com.bank.merchanttwin.seeder;

import com.bank.merchanttwin.config.TwinProperties;
import com.bank.merchanttwin.model.ActionRisk;
import com.bank.merchanttwin.model.BatchResult;
import com.bank.merchanttwin.model.FailureCodeCount;
import com.bank.merchanttwin.model.FleetStats;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.RiskTier;
import com.bank.merchanttwin.service.FleetScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scans the curated registry plus a seeded synthetic fleet and logs the report.
 * Only runs when the "demo" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=demo
 */
@Component
@Profile("demo")
public class FleetReportRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(FleetReportRunner.class);

    private final MerchantRegistry registry;
    private final MerchantGenerator generator;
    private final FleetScanService fleetScanService;
    private final TwinProperties properties;

    public FleetReportRunner(MerchantRegistry registry,
                             MerchantGenerator generator,
                             FleetScanService fleetScanService,
                             TwinProperties properties) {
        this.registry = registry;
        this.generator = generator;
        this.fleetScanService = fleetScanService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        log.info("=== Building demo fleet ===");

        List<Merchant> fleet = new ArrayList<>(registry.merchants());
        fleet.addAll(generator.generateBatch(properties.getGenerator().getBatchSize()));
        log.info("Fleet assembled: {} curated + {} generated (seed={})",
                registry.merchants().size(), properties.getGenerator().getBatchSize(),
                properties.getGenerator().getSeed());

        BatchResult result = fleetScanService.scan(fleet);
        report(result, fleetScanService.tierBreakdown(fleet));

        log.info("=== Demo fleet report complete ===");
    }

    private void report(BatchResult result, Map<RiskTier, Integer> tiers) {
        FleetStats fleet = result.getFleet();
        log.info("Merchants: {} | healthy: {} | with failure: {} | with critical: {} | calls at risk: {}",
                fleet.getTotalMerchants(), fleet.getHealthyMerchants(), fleet.getMerchantsWithAnyFailure(),
                fleet.getMerchantsWithCritical(), fleet.getTotalCallsAtRisk());
        log.info("Risk tiers: {}", tiers);

        for (FailureCodeCount top : fleet.getTopFailures()) {
            log.info("  {} -> {} merchant(s), {}% of fleet, {} occurrence(s)",
                    top.getCode(), top.getCount(), top.getPct(), top.getOccurrences());
        }
        for (ActionRisk row : result.getActionRisk()) {
            log.info("  #{} {} | demand {} | failing {} ({}%) | risk score {}",
                    row.getDemandRank(), row.getLabel(), row.getDemandTotal(),
                    row.getFailingMerchants(), row.getFailureRatePct(), row.getRiskScore());
        }
    }
}
