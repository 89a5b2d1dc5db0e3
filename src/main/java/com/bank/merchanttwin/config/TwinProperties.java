package com.bank.merchanttwin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "twin")
public class TwinProperties {

    private Fleet fleet = new Fleet();

    private Generator generator = new Generator();

    // Failure-rate spike detection over the twin event log
    private Monitor monitor = new Monitor();

    @Data
    public static class Fleet {
        // How many failure codes the fleet summary ranks
        private int topFailureLimit = 5;
        // Map merchants on a parallel stream. Aggregates are identical either way.
        private boolean parallel = false;
    }

    @Data
    public static class Generator {
        private long seed = 42L;
        // Fleet size produced by the demo report runner
        private int batchSize = 50;
    }

    @Data
    public static class Monitor {
        private int windowSize = 10;
        // Below this many events there is no baseline to compare against
        private int minEvents = 10;
        private double spikeZScore = 1.5;
        private double criticalZScore = 2.5;
    }
}
