package com.grc.riskengine.intel;

import java.util.List;

/**
 * Correlates threats and vulnerabilities with external threat intelligence.
 * Implementations return an empty list when the service is unavailable; they never throw.
 */
public interface ThreatIntelCorrelationClient {

    List<ThreatCorrelation> correlate(List<String> threats, List<String> vulnerabilities);
}
