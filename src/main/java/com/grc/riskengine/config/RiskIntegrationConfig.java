package com.grc.riskengine.config;

import com.grc.riskengine.advisory.NoOpRiskAdvisoryService;
import com.grc.riskengine.advisory.RiskAdvisoryService;
import com.grc.riskengine.intel.NoOpThreatIntelCorrelationClient;
import com.grc.riskengine.intel.ThreatIntelCorrelationClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and no-op defaults for the optional external services.
 */
@Configuration
public class RiskIntegrationConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Workers for one processing cycle. */
    @Bean(name = "riskEventExecutor", destroyMethod = "shutdownNow")
    public ExecutorService riskEventExecutor(RiskEngineProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "risk-event-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getBatch().getWorkerThreads()), factory);
    }

    /** Default advisory service; enable the REST client with dynamic-risk.advisory.enabled. */
    @Bean
    @ConditionalOnMissingBean(RiskAdvisoryService.class)
    public RiskAdvisoryService riskAdvisoryService() {
        return new NoOpRiskAdvisoryService();
    }

    @Bean
    @ConditionalOnMissingBean(ThreatIntelCorrelationClient.class)
    public ThreatIntelCorrelationClient threatIntelCorrelationClient() {
        return new NoOpThreatIntelCorrelationClient();
    }
}
