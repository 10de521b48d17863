package com.grc.riskengine.advisory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Asks the advisory service how risky a service looks. Returns empty if the service is down
 * or answers with garbage.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "dynamic-risk.advisory.enabled", havingValue = "true")
public class RestRiskAdvisoryService implements RiskAdvisoryService {

    private final RestTemplate restTemplate;
    private final String classifyUrl;

    public RestRiskAdvisoryService(
            @Value("${dynamic-risk.advisory.url:http://localhost:5000/classify}") String classifyUrl,
            @Value("${dynamic-risk.advisory.timeout-ms:3000}") int timeoutMs) {
        this.classifyUrl = classifyUrl;
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        this.restTemplate = new RestTemplate(factory);
    }

    @Override
    public Optional<AdvisoryRecommendation> classify(AdvisoryContext context) {
        try {
            AdvisoryRecommendation response = restTemplate.postForObject(classifyUrl, context, AdvisoryRecommendation.class);
            if (response == null || (response.getScore() == null && response.getRecommendation() == null)) {
                log.warn("Advisory response for service {} has neither score nor recommendation", context.getServiceId());
                return Optional.empty();
            }
            log.debug("Advisory returned {} (confidence {}) for service {}",
                    response.getRecommendation(), response.getConfidence(), context.getServiceId());
            return Optional.of(response);
        } catch (RestClientException e) {
            log.warn("Advisory call failed for service {}: {}", context.getServiceId(), e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.error("Unexpected error calling advisory service", e);
            return Optional.empty();
        }
    }
}
