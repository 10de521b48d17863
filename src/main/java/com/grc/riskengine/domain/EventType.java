package com.grc.riskengine.domain;

/**
 * Kinds of change events the batch processor understands.
 * <ul>
 *   <li>{@code RISK_SIGNAL}: payload is a trigger; runs the full classify, score, dedupe, decide pipeline</li>
 *   <li>{@code SERVICE_CHANGE}: the referenced service is recomputed</li>
 *   <li>{@code DEPENDENCY_CHANGE}: the referenced service and its dependents are recomputed</li>
 *   <li>{@code RISK_STATUS_CHANGE}: the referenced risk changed approval state</li>
 * </ul>
 */
public enum EventType {
    RISK_SIGNAL, SERVICE_CHANGE, DEPENDENCY_CHANGE, RISK_STATUS_CHANGE
}
