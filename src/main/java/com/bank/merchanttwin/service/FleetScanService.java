package com.bank.merchanttwin.service;

import com.bank.merchanttwin.config.MetricsConfig;
import com.bank.merchanttwin.engine.FleetScanner;
import com.bank.merchanttwin.exception.InvalidMerchantStateException;
import com.bank.merchanttwin.model.BatchResult;
import com.bank.merchanttwin.model.Failure;
import com.bank.merchanttwin.model.FleetStats;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.MerchantScanResult;
import com.bank.merchanttwin.model.RiskTier;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runs fleet scans for callers that want them traced, counted and logged.
 * The scan itself is delegated unchanged to {@link FleetScanner}.
 */
@Service
public class FleetScanService {

    private static final Logger log = LoggerFactory.getLogger(FleetScanService.class);

    private final FleetScanner fleetScanner;
    private final RiskClassificationService riskClassificationService;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public FleetScanService(FleetScanner fleetScanner,
                            RiskClassificationService riskClassificationService,
                            MetricsConfig metricsConfig,
                            Tracer tracer) {
        this.fleetScanner = fleetScanner;
        this.riskClassificationService = riskClassificationService;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    public BatchResult scan(Collection<Merchant> merchants) {
        Span span = tracer.nextSpan()
                .name("fleet.scan")
                .tag("fleet.size", String.valueOf(merchants.size()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            BatchResult result = fleetScanner.scanBatch(merchants);
            FleetStats fleet = result.getFleet();
            span.tag("fleet.with_failure", String.valueOf(fleet.getMerchantsWithAnyFailure()));

            record(result);
            log.info("Fleet scan complete: merchants={}, healthy={}, withFailure={}, withCritical={}, callsAtRisk={}",
                    fleet.getTotalMerchants(), fleet.getHealthyMerchants(), fleet.getMerchantsWithAnyFailure(),
                    fleet.getMerchantsWithCritical(), fleet.getTotalCallsAtRisk());
            return result;
        } catch (InvalidMerchantStateException e) {
            span.error(e);
            log.warn("Fleet scan aborted, corrupt snapshot for merchant {}: {}", e.getMerchantId(), e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Merchant count per risk tier, every tier present.
     */
    public Map<RiskTier, Integer> tierBreakdown(Collection<Merchant> merchants) {
        Map<RiskTier, Integer> counts = new EnumMap<>(RiskTier.class);
        for (RiskTier tier : RiskTier.values()) {
            counts.put(tier, 0);
        }
        for (Merchant merchant : merchants) {
            counts.merge(riskClassificationService.riskTier(merchant), 1, Integer::sum);
        }
        return counts;
    }

    private void record(BatchResult result) {
        metricsConfig.recordMerchantsScanned(result.getFleet().getTotalMerchants());
        for (MerchantScanResult merchantResult : result.getMerchantResults()) {
            RiskTier tier = riskClassificationService.riskTier(merchantResult.getMerchant());
            metricsConfig.recordRiskTier(tier);
            metricsConfig.recordCallsAtRisk(merchantResult.getSummary().getCallsAtRisk());
            for (Failure failure : merchantResult.getFailures()) {
                metricsConfig.recordFailure(failure.getCode(), failure.getSeverity());
            }
            if (log.isDebugEnabled() && !merchantResult.getFailures().isEmpty()) {
                log.debug("Merchant {} tier={} failures={} callsAtRisk={}",
                        merchantResult.getMerchant().getId(), tier, merchantResult.getFailures().size(),
                        merchantResult.getSummary().getCallsAtRisk());
            }
        }
    }
}
