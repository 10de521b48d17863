package com.grc.riskengine.persistence.service;

import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.CascadeImpact;
import com.grc.riskengine.domain.CascadingType;
import com.grc.riskengine.domain.DecisionOutcome;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.domain.RiskCandidate;
import com.grc.riskengine.domain.RiskCategory;
import com.grc.riskengine.domain.RiskDecision;
import com.grc.riskengine.domain.TriggerDescriptor;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.entity.ServiceRiskAssociationEntity;
import com.grc.riskengine.persistence.repository.RiskRepository;
import com.grc.riskengine.persistence.repository.ServiceRiskAssociationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskPersistenceServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private RiskRepository riskRepository;

    @Mock
    private ServiceRiskAssociationRepository associationRepository;

    @InjectMocks
    private RiskPersistenceService persistenceService;

    private static RiskCandidate candidate(String eventId, double confidence, List<String> techniques) {
        return RiskCandidate.builder()
                .title("RCE in gateway")
                .category(RiskCategory.SECURITY)
                .primaryServiceId(1L)
                .serviceIds(List.of(1L))
                .severity(5)
                .likelihood(4)
                .techniques(techniques)
                .trigger(TriggerDescriptor.builder().category(RiskCategory.SECURITY).sourceType("KEV_CVE").confidence(confidence).build())
                .sourceEventId(eventId)
                .build();
    }

    @Test
    void autoApprovedRiskIsCreatedActiveWithDirectAssociation() {
        when(riskRepository.save(any(RiskEntity.class))).thenAnswer(inv -> {
            RiskEntity r = inv.getArgument(0);
            r.setId(10L);
            return r;
        });
        RiskDecision decision = RiskDecision.builder().outcome(DecisionOutcome.AUTO_APPROVE).compositeScore(82).build();

        RiskEntity risk = persistenceService.createRisk(candidate("evt-1", 0.9, List.of("T1190")), decision, "key", NOW);

        assertThat(risk.getLifecycleState()).isEqualTo(LifecycleState.ACTIVE);
        assertThat(risk.getApprovalStatus()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(risk.getApprovedBy()).isEqualTo("system");
        assertThat(risk.getCompositeScore()).isEqualTo(82.0);
        assertThat(risk.getThreatIntelSources()).containsExactly("t1190");
        ArgumentCaptor<ServiceRiskAssociationEntity> association = ArgumentCaptor.forClass(ServiceRiskAssociationEntity.class);
        verify(associationRepository).save(association.capture());
        assertThat(association.getValue().getRiskId()).isEqualTo(10L);
        assertThat(association.getValue().getCascadingType()).isEqualTo(CascadingType.DIRECT);
        assertThat(association.getValue().getWeight()).isEqualTo(1.0);
    }

    @Test
    void mergeUnionsEvidenceAndKeepsHigherConfidence() {
        RiskEntity existing = RiskEntity.builder().id(5L).confidence(0.7)
                .threatIntelSources(new LinkedHashSet<>(List.of("t1190")))
                .mergedFrom(new ArrayList<>(List.of("evt-0")))
                .compositeScore(64)
                .build();
        when(riskRepository.findById(5L)).thenReturn(Optional.of(existing));
        when(riskRepository.save(existing)).thenReturn(existing);

        RiskEntity merged = persistenceService.mergeInto(5L, candidate("evt-2", 0.85, List.of("T1190", "T1059")));

        assertThat(merged.getThreatIntelSources()).containsExactly("t1190", "t1059");
        assertThat(merged.getConfidence()).isEqualTo(0.85);
        assertThat(merged.getMergedFrom()).containsExactly("evt-0", "evt-2");
        assertThat(merged.getCompositeScore()).isEqualTo(64.0);
    }

    @Test
    void cascadeNeverDowngradesDirectAssociation() {
        when(associationRepository.findByServiceIdAndRiskId(2L, 10L)).thenReturn(Optional.of(
                ServiceRiskAssociationEntity.builder().serviceId(2L).riskId(10L).cascadingType(CascadingType.DIRECT).build()));

        boolean written = persistenceService.upsertCascadeAssociation(10L,
                CascadeImpact.builder().serviceId(2L).viaServiceId(1L).depth(1).weight(0.5).cascadedConfidence(0.72).build());

        assertThat(written).isFalse();
        verify(associationRepository, never()).save(any());
    }

    @Test
    void cascadeAssociationNeedingReviewStartsUnapproved() {
        when(associationRepository.findByServiceIdAndRiskId(3L, 10L)).thenReturn(Optional.empty());

        persistenceService.upsertCascadeAssociation(10L, CascadeImpact.builder().serviceId(3L).viaServiceId(2L).depth(2)
                .weight(0.4).cascadedConfidence(0.576).cascadedScore(33.18).requiresApproval(true).build());

        ArgumentCaptor<ServiceRiskAssociationEntity> saved = ArgumentCaptor.forClass(ServiceRiskAssociationEntity.class);
        verify(associationRepository).save(saved.capture());
        assertThat(saved.getValue().getCascadingType()).isEqualTo(CascadingType.DEPENDENCY);
        assertThat(saved.getValue().getCascadeDepth()).isEqualTo(2);
        assertThat(saved.getValue().isRequiresApproval()).isTrue();
        assertThat(saved.getValue().isReviewApproved()).isFalse();
    }

    @Test
    void onlyPendingRisksCanBeDecided() {
        when(riskRepository.findById(5L)).thenReturn(Optional.of(RiskEntity.builder().id(5L)
                .approvalStatus(ApprovalStatus.APPROVED).lifecycleState(LifecycleState.ACTIVE).build()));

        assertThatThrownBy(() -> persistenceService.updateApproval(5L, true, "alice", NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownRiskCannotBeDecided() {
        when(riskRepository.findById(6L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> persistenceService.updateApproval(6L, false, "bob", NOW))
                .isInstanceOf(RiskPersistenceService.RiskNotFoundException.class);
    }
}
