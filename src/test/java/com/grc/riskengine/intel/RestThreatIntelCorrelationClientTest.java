package com.grc.riskengine.intel;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RestThreatIntelCorrelationClientTest {

    @Test
    void unreachableServiceYieldsNoCorrelations() {
        RestThreatIntelCorrelationClient client = new RestThreatIntelCorrelationClient(
                CircuitBreakerRegistry.ofDefaults(), "http://127.0.0.1:1/correlate", 200);

        assertThat(client.correlate(List.of("APT29"), List.of("CVE-2025-1234"))).isEmpty();
    }

    @Test
    void openCircuitSkipsTheCall() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        registry.circuitBreaker(RestThreatIntelCorrelationClient.CIRCUIT_BREAKER).transitionToOpenState();
        RestThreatIntelCorrelationClient client = new RestThreatIntelCorrelationClient(
                registry, "http://127.0.0.1:1/correlate", 200);

        assertThat(client.correlate(null, null)).isEmpty();
    }
}
