package com.grc.riskengine.processing;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.domain.EventStatus;
import com.grc.riskengine.domain.SlaMetrics;
import com.grc.riskengine.persistence.entity.RiskUpdateEventEntity;
import com.grc.riskengine.persistence.repository.RiskUpdateEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Share of events completed within the target latency (event timestamp to completion),
 * over a rolling window. Unfinished events count against compliance.
 */
@Component
@RequiredArgsConstructor
public class SlaTracker {

    private final RiskUpdateEventRepository eventRepository;
    private final RiskEngineProperties properties;
    private final Clock clock;

    public SlaMetrics currentMetrics() {
        Instant end = Instant.now(clock);
        Instant start = end.minus(properties.getSla().getWindow());
        return compute(eventRepository.findByTimestampGreaterThanEqual(start), start, end);
    }

    SlaMetrics compute(List<RiskUpdateEventEntity> events, Instant start, Instant end) {
        long targetMillis = properties.getSla().getTarget().toMillis();
        long withinTarget = 0;
        long processed = 0;
        long failed = 0;
        long pending = 0;
        long timedCount = 0;
        long totalProcessingMillis = 0;
        for (RiskUpdateEventEntity e : events) {
            if (e.getStatus() == EventStatus.COMPLETED) processed++;
            else if (e.getStatus() == EventStatus.FAILED) failed++;
            else pending++;
            if (e.getStatus() == EventStatus.COMPLETED && e.getProcessingCompletedAt() != null && e.getTimestamp() != null
                    && Duration.between(e.getTimestamp(), e.getProcessingCompletedAt()).toMillis() < targetMillis) {
                withinTarget++;
            }
            if (e.getProcessingCompletedAt() != null && e.getProcessingStartedAt() != null) {
                totalProcessingMillis += Duration.between(e.getProcessingStartedAt(), e.getProcessingCompletedAt()).toMillis();
                timedCount++;
            }
        }
        double rate = events.isEmpty() ? 100.0 : Math.round(withinTarget * 10000.0 / events.size()) / 100.0;
        return SlaMetrics.builder()
                .windowStart(start)
                .windowEnd(end)
                .totalEvents(events.size())
                .completedWithinTarget(withinTarget)
                .complianceRate(rate)
                .averageProcessingMillis(timedCount > 0 ? (double) totalProcessingMillis / timedCount : 0)
                .processedEvents(processed)
                .failedEvents(failed)
                .pendingEvents(pending)
                .build();
    }
}
