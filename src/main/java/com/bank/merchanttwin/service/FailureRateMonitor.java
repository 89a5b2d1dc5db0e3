package com.bank.merchanttwin.service;

import com.bank.merchanttwin.config.TwinProperties;
import com.bank.merchanttwin.model.FailureRateAnomaly;
import com.bank.merchanttwin.model.Severity;
import com.bank.merchanttwin.model.TwinEvent;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Flags a spike in the fleet's failure rate. Every sliding window of the event
 * log contributes one failure rate; the latest window is compared to all of
 * them by z-score. Warnings do not count as failures.
 */
@Service
public class FailureRateMonitor {

    private final TwinProperties properties;

    public FailureRateMonitor(TwinProperties properties) {
        this.properties = properties;
    }

    /**
     * @param events event log, oldest first
     * @return at most one anomaly; empty when there is no spike or too little history
     */
    public List<FailureRateAnomaly> detect(List<TwinEvent> events) {
        TwinProperties.Monitor config = properties.getMonitor();
        int windowSize = config.getWindowSize();
        if (windowSize <= 0) {
            throw new IllegalArgumentException("twin.monitor.window-size must be positive, got " + windowSize);
        }
        if (events.size() < Math.max(config.getMinEvents(), windowSize)) {
            return Collections.emptyList();
        }

        double[] rates = new double[events.size() - windowSize + 1];
        for (int start = 0; start < rates.length; start++) {
            int failures = 0;
            for (TwinEvent event : events.subList(start, start + windowSize)) {
                if (event.isFailure()) failures++;
            }
            rates[start] = (double) failures / windowSize;
        }

        double mean = 0.0;
        for (double rate : rates) mean += rate;
        mean /= rates.length;

        double variance = 0.0;
        for (double rate : rates) variance += Math.pow(rate - mean, 2);
        variance /= rates.length;
        double stdDev = Math.sqrt(variance);

        double latest = rates[rates.length - 1];
        double zScore = stdDev > 0 ? (latest - mean) / stdDev : 0.0;
        if (zScore <= config.getSpikeZScore()) {
            return Collections.emptyList();
        }

        return List.of(FailureRateAnomaly.builder()
                .type(FailureRateAnomaly.FAILURE_RATE_SPIKE)
                .severity(zScore > config.getCriticalZScore() ? Severity.CRITICAL : Severity.HIGH)
                .zScore(Math.round(zScore * 100.0) / 100.0)
                .latestRate(latest)
                .baselineRate(Math.round(mean * 1000.0) / 1000.0)
                .message(String.format(Locale.US, "Failure rate anomaly detected: %.0f%% vs baseline %.0f%%",
                        latest * 100, mean * 100))
                .build());
    }
}
