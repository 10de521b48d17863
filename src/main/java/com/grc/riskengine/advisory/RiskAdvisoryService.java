package com.grc.riskengine.advisory;

import java.util.Optional;

/**
 * LLM-backed classifier consulted by the scoring engine's prediction step.
 * Implementations must not throw for an unavailable service; they return empty.
 */
public interface RiskAdvisoryService {

    Optional<AdvisoryRecommendation> classify(AdvisoryContext context);

    /** False when no advisory backend is configured. */
    default boolean isEnabled() {
        return true;
    }
}
