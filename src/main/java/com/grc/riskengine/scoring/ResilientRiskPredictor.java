package com.grc.riskengine.scoring;

import com.grc.riskengine.domain.Prediction;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Selects between the advisory predictor and the rule-based fallback. The advisory call
 * runs behind the {@code riskAdvisory} circuit breaker; HTTP timeouts bound each call.
 * Prediction never fails.
 */
@Slf4j
@Component
public class ResilientRiskPredictor {

    static final String CIRCUIT_BREAKER = "riskAdvisory";

    private final AdvisoryRiskPredictor primary;
    private final RuleBasedRiskPredictor fallback;
    private final CircuitBreaker circuitBreaker;

    public ResilientRiskPredictor(AdvisoryRiskPredictor primary,
                                  RuleBasedRiskPredictor fallback,
                                  CircuitBreakerRegistry circuitBreakerRegistry) {
        this.primary = primary;
        this.fallback = fallback;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
    }

    public Prediction predict(ScoringFeatures features) {
        if (!primary.isAvailable()) {
            return fallback.predict(features);
        }
        Supplier<Prediction> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, () -> primary.predict(features));
        try {
            return guarded.get();
        } catch (CallNotPermittedException e) {
            log.warn("Advisory circuit open, using rule-based prediction for service {}", features.getServiceId());
        } catch (PredictionUnavailableException e) {
            log.warn("Advisory prediction unavailable for service {}: {}", features.getServiceId(), e.getMessage());
        } catch (Exception e) {
            log.error("Advisory prediction failed for service {}", features.getServiceId(), e);
        }
        return fallback.predict(features);
    }
}
