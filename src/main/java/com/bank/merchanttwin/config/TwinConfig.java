package com.bank.merchanttwin.config;

import com.bank.merchanttwin.engine.DefaultRuleCatalog;
import com.bank.merchanttwin.engine.RuleCatalog;
import io.micrometer.tracing.Tracer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TwinConfig {

    @Bean
    public RuleCatalog ruleCatalog() {
        return DefaultRuleCatalog.create();
    }

    // Stamps mutation and generation times
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // No tracing bridge on the classpath by default; spans go nowhere until one is added
    @Bean
    @ConditionalOnMissingBean
    public Tracer tracer() {
        return Tracer.NOOP;
    }
}
