package com.grc.riskengine.intel;

import java.util.List;

/**
 * No-op implementation: no correlation service configured. Registered as default via RiskIntegrationConfig.
 */
public class NoOpThreatIntelCorrelationClient implements ThreatIntelCorrelationClient {

    @Override
    public List<ThreatCorrelation> correlate(List<String> threats, List<String> vulnerabilities) {
        return List.of();
    }
}
