package com.grc.riskengine.advisory;

import java.util.Optional;

/**
 * No-op implementation: no advisory call. Registered as default via RiskIntegrationConfig,
 * so scoring always uses the rule-based predictor.
 */
public class NoOpRiskAdvisoryService implements RiskAdvisoryService {

    @Override
    public Optional<AdvisoryRecommendation> classify(AdvisoryContext context) {
        return Optional.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
