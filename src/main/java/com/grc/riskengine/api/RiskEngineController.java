package com.grc.riskengine.api;

import com.grc.riskengine.domain.ProcessingCycleSummary;
import com.grc.riskengine.domain.RiskChangeNotification;
import com.grc.riskengine.domain.ServiceRiskScore;
import com.grc.riskengine.domain.SlaMetrics;
import com.grc.riskengine.messaging.RiskUpdateEventMessage;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.entity.ServiceRiskAssociationEntity;
import com.grc.riskengine.processing.NotificationService;
import com.grc.riskengine.processing.ProcessingCycleStore;
import com.grc.riskengine.processing.RiskApprovalService;
import com.grc.riskengine.processing.RiskEventQueueService;
import com.grc.riskengine.processing.SlaTracker;
import com.grc.riskengine.scoring.ServiceRiskScoringEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operations API: event ingestion, SLA and cycle metrics, notifications, approvals and
 * on-demand recompute.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/risk-engine")
@RequiredArgsConstructor
@Tag(name = "Risk Engine", description = "Dynamic risk scoring, approvals and processing metrics")
public class RiskEngineController {

    private final RiskEventQueueService queueService;
    private final SlaTracker slaTracker;
    private final ProcessingCycleStore cycleStore;
    private final NotificationService notificationService;
    private final RiskApprovalService approvalService;
    private final ServiceRiskScoringEngine scoringEngine;

    @PostMapping("/events")
    @Operation(summary = "Queue an event", description = "Queues a risk update event for the next processing cycle")
    public ResponseEntity<Map<String, String>> queueEvent(@Valid @RequestBody RiskEventRequestDto request) {
        String eventId = queueService.enqueue(RiskUpdateEventMessage.builder()
                .eventId(request.getEventId())
                .eventType(request.getEventType())
                .source(request.getSource())
                .entityType(request.getEntityType())
                .entityId(request.getEntityId())
                .priority(request.getPriority())
                .payload(request.getPayload())
                .build());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("eventId", eventId, "status", "QUEUED"));
    }

    @GetMapping("/sla")
    @Operation(summary = "SLA metrics", description = "Share of events completed within the target latency over the rolling window")
    public ResponseEntity<SlaMetrics> sla() {
        return ResponseEntity.ok(slaTracker.currentMetrics());
    }

    @GetMapping("/cycles")
    @Operation(summary = "Recent processing cycles", description = "In-memory; last 100 cycles")
    public ResponseEntity<List<ProcessingCycleSummary>> cycles(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(cycleStore.getRecent(limit));
    }

    @GetMapping("/notifications")
    @Operation(summary = "Recent score-change notifications", description = "Most recent first")
    public ResponseEntity<List<RiskChangeNotification>> notifications(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(notificationService.recent(limit));
    }

    @PostMapping("/risks/{riskId}/approval")
    @Operation(summary = "Approve or reject a pending risk")
    public ResponseEntity<RiskApprovalResponseDto> decideRisk(@PathVariable Long riskId,
                                                              @Valid @RequestBody RiskApprovalRequestDto request) {
        RiskEntity risk = approvalService.decide(riskId, request.getApproved(), request.getActor(), request.getComment());
        return ResponseEntity.ok(RiskApprovalResponseDto.from(risk));
    }

    @PostMapping("/associations/{associationId}/approval")
    @Operation(summary = "Approve a cascaded association held for review")
    public ResponseEntity<Map<String, Object>> approveAssociation(@PathVariable Long associationId,
                                                                  @Valid @RequestBody AssociationApprovalRequestDto request) {
        ServiceRiskAssociationEntity association = approvalService.approveAssociation(associationId, request.getActor());
        return ResponseEntity.ok(Map.of(
                "associationId", association.getId(),
                "serviceId", association.getServiceId(),
                "riskId", association.getRiskId(),
                "reviewApproved", association.isReviewApproved()));
    }

    @PostMapping("/services/{serviceId}/recompute")
    @Operation(summary = "Recompute a service score now")
    public ResponseEntity<ServiceRiskScore> recompute(@PathVariable Long serviceId) {
        log.info("Manual recompute requested for service {}", serviceId);
        return ResponseEntity.ok(scoringEngine.recompute(serviceId));
    }
}
