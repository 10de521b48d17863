package com.grc.riskengine.trigger;

import com.grc.riskengine.domain.RiskCategory;
import com.grc.riskengine.domain.TriggerDescriptor;
import com.grc.riskengine.domain.Urgency;
import com.grc.riskengine.domain.trigger.ComplianceTrigger;
import com.grc.riskengine.domain.trigger.OperationalTrigger;
import com.grc.riskengine.domain.trigger.SecurityTrigger;
import com.grc.riskengine.domain.trigger.StrategicTrigger;
import com.grc.riskengine.intel.ThreatCorrelation;
import com.grc.riskengine.intel.ThreatIntelCorrelationClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriggerClassifierTest {

    @Mock
    private ThreatIntelCorrelationClient correlationClient;

    @InjectMocks
    private TriggerClassifier classifier;

    @Test
    void kevMatchIsHighConfidenceKnownExploitedAndEligible() {
        SecurityTrigger kev = SecurityTrigger.builder()
                .type(SecurityTrigger.Type.KEV_CVE)
                .sourceSystem("DEFENDER")
                .title("CVE-2024-3400 on edge firewall")
                .severityScore(90)
                .cveIds(List.of("CVE-2024-3400"))
                .build();
        when(correlationClient.correlate(anyList(), anyList())).thenReturn(List.of());

        TriggerDescriptor descriptor = classifier.classify(kev);

        assertThat(descriptor.getCategory()).isEqualTo(RiskCategory.SECURITY);
        assertThat(descriptor.getConfidence()).isEqualTo(0.95);
        assertThat(descriptor.isKnownExploited()).isTrue();
        assertThat(descriptor.isAutoApproveEligible()).isTrue();
        assertThat(descriptor.getUrgency()).isEqualTo(Urgency.CRITICAL);
    }

    @Test
    void lowSeverityDefenderIncidentKeepsReportedConfidence() {
        SecurityTrigger incident = SecurityTrigger.builder()
                .type(SecurityTrigger.Type.DEFENDER_INCIDENT)
                .title("Suspicious sign-in")
                .reportedConfidence(0.55)
                .severityScore(40)
                .build();

        TriggerDescriptor descriptor = classifier.classify(incident);

        assertThat(descriptor.getConfidence()).isEqualTo(0.55);
        assertThat(descriptor.isAutoApproveEligible()).isFalse();
        assertThat(descriptor.getUrgency()).isEqualTo(Urgency.MEDIUM);
        verifyNoInteractions(correlationClient);
    }

    @Test
    void activeExploitationRaisesUrgencyAndConfidence() {
        SecurityTrigger incident = SecurityTrigger.builder()
                .type(SecurityTrigger.Type.TI_CORROBORATION)
                .title("Beaconing to known C2")
                .severityScore(50)
                .threatActors(List.of("APT29"))
                .build();
        when(correlationClient.correlate(anyList(), anyList())).thenReturn(List.of(ThreatCorrelation.builder()
                .threat("APT29")
                .confidence(0.9)
                .activeExploitation(true)
                .build()));

        TriggerDescriptor descriptor = classifier.classify(incident);

        assertThat(descriptor.getConfidence()).isCloseTo(0.9, within(1e-9));
        assertThat(descriptor.getUrgency()).isEqualTo(Urgency.CRITICAL);
        assertThat(descriptor.isAutoApproveEligible()).isTrue();
    }

    @Test
    void correlationFailureDoesNotBlockClassification() {
        SecurityTrigger incident = SecurityTrigger.builder()
                .type(SecurityTrigger.Type.MULTI_STAGE_ATTACK)
                .title("Lateral movement")
                .severityScore(70)
                .killChainCoverage(0.7)
                .techniques(List.of("T1021"))
                .build();
        when(correlationClient.correlate(anyList(), anyList())).thenThrow(new RuntimeException("timeout"));

        TriggerDescriptor descriptor = classifier.classify(incident);

        assertThat(descriptor.getConfidence()).isEqualTo(0.85);
        assertThat(descriptor.isAutoApproveEligible()).isTrue();
        assertThat(descriptor.getUrgency()).isEqualTo(Urgency.HIGH);
    }

    @Test
    void repeatedIncidentsBecomeEligibleFromThirdRecurrence() {
        OperationalTrigger twice = OperationalTrigger.builder()
                .type(OperationalTrigger.Type.REPEATED_INCIDENTS).title("Checkout outage").recurrenceCount(2).build();
        OperationalTrigger thrice = OperationalTrigger.builder()
                .type(OperationalTrigger.Type.REPEATED_INCIDENTS).title("Checkout outage").recurrenceCount(3).build();

        assertThat(classifier.classify(twice).isAutoApproveEligible()).isFalse();
        assertThat(classifier.classify(twice).getConfidence()).isEqualTo(0.8);
        assertThat(classifier.classify(thrice).isAutoApproveEligible()).isTrue();
        assertThat(classifier.classify(thrice).getUrgency()).isEqualTo(Urgency.HIGH);
    }

    @Test
    void failedChangeWithLongOutageIsCritical() {
        OperationalTrigger change = OperationalTrigger.builder()
                .type(OperationalTrigger.Type.FAILED_CHANGE).title("DB migration rollback").businessImpactHours(6.0).build();

        TriggerDescriptor descriptor = classifier.classify(change);

        assertThat(descriptor.getConfidence()).isEqualTo(0.85);
        assertThat(descriptor.getUrgency()).isEqualTo(Urgency.CRITICAL);
    }

    @Test
    void auditFindingIsHighConfidenceCompliance() {
        ComplianceTrigger finding = ComplianceTrigger.builder()
                .type(ComplianceTrigger.Type.AUDIT_FINDING).title("Access review missing").framework("SOC2").build();

        TriggerDescriptor descriptor = classifier.classify(finding);

        assertThat(descriptor.getCategory()).isEqualTo(RiskCategory.COMPLIANCE);
        assertThat(descriptor.getConfidence()).isEqualTo(0.9);
        assertThat(descriptor.getUrgency()).isEqualTo(Urgency.HIGH);
    }

    @Test
    void regulatoryMandateEligibleOnlyWithShortTimeline() {
        StrategicTrigger soon = StrategicTrigger.builder()
                .type(StrategicTrigger.Type.REGULATORY_MANDATE).title("DORA").timelineDays(60).build();
        StrategicTrigger later = StrategicTrigger.builder()
                .type(StrategicTrigger.Type.REGULATORY_MANDATE).title("DORA").timelineDays(200).build();

        assertThat(classifier.classify(soon).isAutoApproveEligible()).isTrue();
        assertThat(classifier.classify(later).isAutoApproveEligible()).isFalse();
        assertThat(classifier.classify(soon).getConfidence()).isEqualTo(0.85);
    }
}
