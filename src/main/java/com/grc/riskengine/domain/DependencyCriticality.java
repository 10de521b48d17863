package com.grc.riskengine.domain;

/**
 * Criticality of a dependency edge. Each level carries the default fraction of
 * upstream risk that flows to the dependent service.
 */
public enum DependencyCriticality {
    LOW(0.2),
    MEDIUM(0.5),
    HIGH(0.8);

    private final double propagationFactor;

    DependencyCriticality(double propagationFactor) {
        this.propagationFactor = propagationFactor;
    }

    public double getPropagationFactor() {
        return propagationFactor;
    }
}
