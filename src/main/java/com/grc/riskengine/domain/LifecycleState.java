package com.grc.riskengine.domain;

/**
 * Lifecycle of a risk record. Risks are never deleted, only transitioned.
 */
public enum LifecycleState {
    DRAFT, ACTIVE, SUPPRESSED, MITIGATED, ACCEPTED, TRANSFERRED
}
