package com.bank.merchanttwin.service;

import com.bank.merchanttwin.config.TwinProperties;
import com.bank.merchanttwin.model.ActionKey;
import com.bank.merchanttwin.model.FailureRateAnomaly;
import com.bank.merchanttwin.model.Outcome;
import com.bank.merchanttwin.model.Severity;
import com.bank.merchanttwin.model.TwinEvent;
import com.bank.merchanttwin.testutil.TestMerchants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FailureRateMonitorTest {

    private TwinProperties properties;
    private FailureRateMonitor monitor;

    @BeforeEach
    void setUp() {
        properties = new TwinProperties();
        monitor = new FailureRateMonitor(properties);
    }

    @Test
    void detect_tooFewEvents_noAnomaly() {
        assertThat(monitor.detect(events(0, 9, Outcome.FAIL))).isEmpty();
    }

    @Test
    void detect_steadyFailureRate_noAnomaly() {
        assertThat(monitor.detect(events(30, 0, Outcome.FAIL))).isEmpty();
        assertThat(monitor.detect(events(0, 30, Outcome.FAIL))).isEmpty();
    }

    @Test
    void detect_recentBurst_highSeveritySpike() {
        // 21 windows: 11 clean, then the failure rate ramps to 100%
        List<FailureRateAnomaly> anomalies = monitor.detect(events(20, 10, Outcome.FAIL));

        assertThat(anomalies).hasSize(1);
        FailureRateAnomaly spike = anomalies.get(0);
        assertThat(spike.getType()).isEqualTo(FailureRateAnomaly.FAILURE_RATE_SPIKE);
        assertThat(spike.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(spike.getZScore()).isCloseTo(2.18, within(0.01));
        assertThat(spike.getLatestRate()).isEqualTo(1.0);
        assertThat(spike.getBaselineRate()).isCloseTo(0.262, within(0.001));
        assertThat(spike.getMessage()).isEqualTo("Failure rate anomaly detected: 100% vs baseline 26%");
    }

    @Test
    void detect_burstAfterLongCleanHistory_criticalSpike() {
        List<FailureRateAnomaly> anomalies = monitor.detect(events(40, 10, Outcome.FAIL));

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomalies.get(0).getZScore()).isGreaterThan(2.5);
    }

    @Test
    void detect_warningsAreNotFailures() {
        assertThat(monitor.detect(events(20, 10, Outcome.WARN))).isEmpty();
    }

    @Test
    void detect_higherSpikeThreshold_suppressesAnomaly() {
        properties.getMonitor().setSpikeZScore(2.5);

        assertThat(monitor.detect(events(20, 10, Outcome.FAIL))).isEmpty();
    }

    @Test
    void detect_invalidWindowSize_rejected() {
        properties.getMonitor().setWindowSize(0);

        assertThatThrownBy(() -> monitor.detect(events(20, 10, Outcome.FAIL)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<TwinEvent> events(int passes, int tail, Outcome tailOutcome) {
        List<TwinEvent> events = new ArrayList<>();
        for (int i = 0; i < passes + tail; i++) {
            events.add(TwinEvent.builder()
                    .merchantId("M00" + (i % 5 + 1))
                    .actionKey(ActionKey.SETTLE_FUNDS)
                    .outcome(i < passes ? Outcome.PASS : tailOutcome)
                    .occurredAt(TestMerchants.NOW.plusSeconds(i))
                    .build());
        }
        return events;
    }
}
