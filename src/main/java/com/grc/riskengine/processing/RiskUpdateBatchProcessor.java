package com.grc.riskengine.processing;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.core.EventValidationException;
import com.grc.riskengine.core.ServiceLockRegistry;
import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.domain.ProcessingCycleSummary;
import com.grc.riskengine.domain.RiskChangeNotification;
import com.grc.riskengine.domain.ServiceRiskScore;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.entity.RiskUpdateEventEntity;
import com.grc.riskengine.persistence.repository.RiskRepository;
import com.grc.riskengine.persistence.service.RiskPersistenceService;
import com.grc.riskengine.scoring.ServiceRiskScoringEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic cycle over the event queue. Claims a priority-ordered batch, processes the
 * events on a worker pool under a cycle deadline, recomputes affected services, and emits
 * notifications for significant score changes. One event's failure never affects another.
 */
@Slf4j
@Component
public class RiskUpdateBatchProcessor {

    private final RiskEventQueueService queueService;
    private final RiskEventPipeline pipeline;
    private final ServiceRiskScoringEngine scoringEngine;
    private final NotificationService notificationService;
    private final ProcessingCycleStore cycleStore;
    private final RiskRepository riskRepository;
    private final ServiceLockRegistry lockRegistry;
    private final ExecutorService executor;
    private final RiskEngineProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RiskUpdateBatchProcessor(RiskEventQueueService queueService,
                                    RiskEventPipeline pipeline,
                                    ServiceRiskScoringEngine scoringEngine,
                                    NotificationService notificationService,
                                    ProcessingCycleStore cycleStore,
                                    RiskRepository riskRepository,
                                    ServiceLockRegistry lockRegistry,
                                    @Qualifier("riskEventExecutor") ExecutorService executor,
                                    RiskEngineProperties properties,
                                    Clock clock) {
        this.queueService = queueService;
        this.pipeline = pipeline;
        this.scoringEngine = scoringEngine;
        this.notificationService = notificationService;
        this.cycleStore = cycleStore;
        this.riskRepository = riskRepository;
        this.lockRegistry = lockRegistry;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    enum EventOutcome { PROCESSED, FAILED, RETRY }

    @Scheduled(fixedDelayString = "${dynamic-risk.batch.cycle-interval-ms:60000}",
            initialDelayString = "${dynamic-risk.batch.initial-delay-ms:10000}")
    public void runScheduledCycle() {
        try {
            runCycle();
        } catch (Exception e) {
            log.error("Risk processing cycle aborted", e);
        }
    }

    /**
     * Runs one cycle unless processing is disabled or a cycle is already running.
     */
    public Optional<ProcessingCycleSummary> runCycle() {
        if (!properties.isProcessingEnabled()) {
            log.debug("Risk processing disabled, skipping cycle");
            return Optional.empty();
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous risk processing cycle still running, skipping");
            return Optional.empty();
        }
        try {
            return Optional.of(processBatch());
        } finally {
            running.set(false);
        }
    }

    private ProcessingCycleSummary processBatch() {
        RiskEngineProperties.Batch config = properties.getBatch();
        String cycleId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now(clock);
        Instant deadline = startedAt.plus(config.getTimeout());

        int recovered = queueService.recoverStale(startedAt.minus(config.getTimeout()));
        List<RiskUpdateEventEntity> batch = queueService.fetchNextBatch(config.getBatchSize());
        log.info("Risk cycle {} started: {} events queued, {} stale recovered", cycleId, batch.size(), recovered);

        CycleScoreTracker tracker = new CycleScoreTracker();
        Map<RiskUpdateEventEntity, Future<EventOutcome>> submitted = new LinkedHashMap<>();
        for (RiskUpdateEventEntity event : batch) {
            if (!queueService.claim(event.getEventId())) {
                log.debug("Event {} already claimed elsewhere", event.getEventId());
                continue;
            }
            event.setAttempts(event.getAttempts() + 1);
            try {
                submitted.put(event, executor.submit(() -> handle(event, tracker)));
            } catch (RejectedExecutionException e) {
                log.error("Worker pool rejected event {}", event.getEventId(), e);
                queueService.releaseForRetry(event, "Worker pool rejected event");
            }
        }

        int processed = 0, failed = 0, retried = 0, timedOut = 0;
        for (Map.Entry<RiskUpdateEventEntity, Future<EventOutcome>> entry : submitted.entrySet()) {
            RiskUpdateEventEntity event = entry.getKey();
            long remaining = Math.max(0, Duration.between(Instant.now(clock), deadline).toMillis());
            try {
                EventOutcome outcome = entry.getValue().get(remaining, TimeUnit.MILLISECONDS);
                switch (outcome) {
                    case PROCESSED:
                        processed++;
                        break;
                    case FAILED:
                        failed++;
                        break;
                    default:
                        retried++;
                }
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                timedOut++;
                log.warn("Event {} did not finish before the cycle deadline", event.getEventId());
                if (!queueService.releaseForRetry(event, "Processing timed out after " + config.getTimeout())) failed++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Risk cycle {} interrupted", cycleId);
                queueService.releaseForRetry(event, "Processing interrupted");
                break;
            } catch (ExecutionException e) {
                log.error("Unexpected failure processing event {}", event.getEventId(), e.getCause());
                if (queueService.releaseForRetry(event, String.valueOf(e.getCause()))) retried++;
                else failed++;
            }
        }

        int notifications = emitNotifications(tracker);
        warnAboutAgedApprovals(startedAt);

        ProcessingCycleSummary summary = ProcessingCycleSummary.builder()
                .cycleId(cycleId)
                .startedAt(startedAt)
                .finishedAt(Instant.now(clock))
                .claimed(submitted.size())
                .processed(processed)
                .failed(failed)
                .retried(retried)
                .timedOut(timedOut)
                .servicesRecomputed(tracker.servicesRecomputed())
                .notificationsEmitted(notifications)
                .build();
        cycleStore.add(summary);
        log.info("Risk cycle {} finished: claimed={} processed={} failed={} retried={} timedOut={} services={} notifications={}",
                cycleId, summary.getClaimed(), processed, failed, retried, timedOut, summary.getServicesRecomputed(), notifications);
        return summary;
    }

    EventOutcome handle(RiskUpdateEventEntity event, CycleScoreTracker tracker) {
        try {
            PipelineResult result = pipeline.process(event);
            for (Long serviceId : result.getAffectedServiceIds()) {
                // Recorded under the same lock so the cycle sees recomputes in the order they ran.
                lockRegistry.withLock(serviceId, () -> {
                    ServiceRiskScore score = scoringEngine.recompute(serviceId);
                    tracker.record(score, event.getEventId());
                });
            }
            queueService.markCompleted(event.getEventId());
            log.debug("Event {} processed: {} risk={} services={}",
                    event.getEventId(), result.getOutcome(), result.getRiskId(), result.getAffectedServiceIds());
            return EventOutcome.PROCESSED;
        } catch (EventValidationException | ServiceRiskScoringEngine.ServiceNotFoundException
                 | RiskPersistenceService.RiskNotFoundException | IllegalArgumentException e) {
            log.warn("Event {} failed permanently: {}", event.getEventId(), e.getMessage());
            queueService.markFailed(event.getEventId(), e.getMessage());
            return EventOutcome.FAILED;
        } catch (Exception e) {
            log.error("Event {} failed on attempt {}, will retry if attempts remain", event.getEventId(), event.getAttempts(), e);
            return queueService.releaseForRetry(event, e.getClass().getSimpleName() + ": " + e.getMessage())
                    ? EventOutcome.RETRY : EventOutcome.FAILED;
        }
    }

    private int emitNotifications(CycleScoreTracker tracker) {
        int emitted = 0;
        Instant now = Instant.now(clock);
        for (CycleScoreTracker.ServiceDelta delta : tracker.deltas()) {
            Optional<RiskChangeNotification> notification = NotificationPolicy.evaluate(delta.serviceId, delta.serviceName,
                    delta.previousScore, delta.currentScore, new ArrayList<>(delta.eventIds), now);
            if (notification.isPresent()) {
                notificationService.deliver(notification.get());
                emitted++;
            }
        }
        return emitted;
    }

    private void warnAboutAgedApprovals(Instant now) {
        try {
            Instant cutoff = now.minus(properties.getBatch().getPendingApprovalAlertAge());
            List<RiskEntity> aged = riskRepository.findByApprovalStatusAndLifecycleStateAndCreatedAtBefore(
                    ApprovalStatus.PENDING, LifecycleState.DRAFT, cutoff);
            for (RiskEntity risk : aged) {
                log.warn("Risk {} '{}' on service {} has been pending approval since {}",
                        risk.getId(), risk.getTitle(), risk.getPrimaryServiceId(), risk.getCreatedAt());
            }
        } catch (Exception e) {
            log.error("Pending approval check failed", e);
        }
    }
}
