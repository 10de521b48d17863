package com.grc.riskengine.domain;

/**
 * Declared business criticality of a service. Drives the business-impact and
 * technical-requirement lookup tables used by the scoring engine.
 */
public enum CriticalityLevel {
    LOW, MEDIUM, HIGH, CRITICAL
}
