package com.grc.riskengine.processing;

import com.grc.riskengine.domain.ServiceRiskScore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-cycle record of score changes: the score each service had before its first
 * recompute in the cycle, its latest score, and the events that touched it.
 */
class CycleScoreTracker {

    private final Map<Long, ServiceDelta> deltas = new ConcurrentHashMap<>();

    void record(ServiceRiskScore score, String eventId) {
        deltas.compute(score.getServiceId(), (id, existing) -> {
            ServiceDelta delta = existing != null ? existing : new ServiceDelta(id, score.getServiceName(), score.getPreviousScore());
            delta.currentScore = score.getCompositeScore();
            delta.eventIds.add(eventId);
            return delta;
        });
    }

    List<ServiceDelta> deltas() {
        return new ArrayList<>(deltas.values());
    }

    int servicesRecomputed() {
        return deltas.size();
    }

    static final class ServiceDelta {
        final Long serviceId;
        final String serviceName;
        final Double previousScore;
        double currentScore;
        final Set<String> eventIds = new LinkedHashSet<>();

        ServiceDelta(Long serviceId, String serviceName, Double previousScore) {
            this.serviceId = serviceId;
            this.serviceName = serviceName;
            this.previousScore = previousScore;
        }
    }
}
