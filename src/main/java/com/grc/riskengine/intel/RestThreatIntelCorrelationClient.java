package com.grc.riskengine.intel;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls the threat-intel correlation service over HTTP. Guarded by the
 * {@code threatIntel} circuit breaker; any failure yields an empty list.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "dynamic-risk.threat-intel.enabled", havingValue = "true")
public class RestThreatIntelCorrelationClient implements ThreatIntelCorrelationClient {

    static final String CIRCUIT_BREAKER = "threatIntel";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String correlateUrl;

    public RestThreatIntelCorrelationClient(
            CircuitBreakerRegistry circuitBreakerRegistry,
            @Value("${dynamic-risk.threat-intel.url:http://localhost:5100/correlate}") String correlateUrl,
            @Value("${dynamic-risk.threat-intel.timeout-ms:2000}") int timeoutMs) {
        this.correlateUrl = correlateUrl;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        this.restTemplate = new RestTemplate(factory);
    }

    @Override
    public List<ThreatCorrelation> correlate(List<String> threats, List<String> vulnerabilities) {
        Map<String, Object> request = new HashMap<>();
        request.put("threats", threats != null ? threats : List.of());
        request.put("vulnerabilities", vulnerabilities != null ? vulnerabilities : List.of());
        try {
            ThreatCorrelation[] response = circuitBreaker.executeSupplier(
                    () -> restTemplate.postForObject(correlateUrl, request, ThreatCorrelation[].class));
            if (response == null) {
                log.warn("Threat-intel service returned an empty body");
                return List.of();
            }
            log.debug("Threat-intel returned {} correlations", response.length);
            return Arrays.asList(response);
        } catch (CallNotPermittedException e) {
            log.warn("Threat-intel circuit open, classifying without correlation");
            return List.of();
        } catch (RestClientException e) {
            log.warn("Threat-intel correlation failed: {}", e.getMessage());
            return List.of();
        } catch (Exception e) {
            log.error("Unexpected error calling threat-intel service", e);
            return List.of();
        }
    }
}
