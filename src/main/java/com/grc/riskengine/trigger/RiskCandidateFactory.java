package com.grc.riskengine.trigger;

import com.grc.riskengine.core.EventValidationException;
import com.grc.riskengine.domain.RiskCandidate;
import com.grc.riskengine.domain.TriggerDescriptor;
import com.grc.riskengine.domain.Urgency;
import com.grc.riskengine.domain.trigger.SecurityTrigger;
import com.grc.riskengine.domain.trigger.TriggerSignal;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the risk candidate a classified trigger proposes: severity and likelihood on 1–5,
 * CIA impacts on 1–10, services, evidence.
 */
@Component
public class RiskCandidateFactory {

    public RiskCandidate build(TriggerSignal signal, TriggerDescriptor descriptor, String eventId, Long fallbackServiceId) {
        List<Long> services = new ArrayList<>();
        if (signal.getAffectedServiceIds() != null) {
            signal.getAffectedServiceIds().stream().filter(id -> id != null && !services.contains(id)).forEach(services::add);
        }
        if (services.isEmpty() && fallbackServiceId != null) {
            services.add(fallbackServiceId);
        }
        if (services.isEmpty()) {
            throw new EventValidationException("Event " + eventId + " names no affected service");
        }

        int severity = severity(signal, descriptor.getUrgency());
        int likelihood = clamp((int) Math.round(descriptor.getConfidence() * 5), 1, 5);
        int base = impactBase(descriptor.getUrgency());
        int[] cia = ciaImpacts(signal, base);

        RiskCandidate.RiskCandidateBuilder builder = RiskCandidate.builder()
                .title(title(signal, descriptor))
                .description(signal.getDescription())
                .category(descriptor.getCategory())
                .primaryServiceId(services.get(0))
                .serviceIds(services)
                .severity(severity)
                .likelihood(likelihood)
                .confidentialityImpact(cia[0])
                .integrityImpact(cia[1])
                .availabilityImpact(cia[2])
                .trigger(descriptor)
                .sourceEventId(eventId)
                .threatActors(List.of())
                .techniques(List.of())
                .indicators(List.of());
        if (signal instanceof SecurityTrigger) {
            SecurityTrigger security = (SecurityTrigger) signal;
            builder.threatActors(nullToEmpty(security.getThreatActors()))
                    .techniques(nullToEmpty(security.getTechniques()))
                    .indicators(concat(security.getIndicators(), security.getCveIds()));
        }
        return builder.build();
    }

    private static String title(TriggerSignal signal, TriggerDescriptor descriptor) {
        if (signal.getTitle() != null && !signal.getTitle().isBlank()) {
            return signal.getTitle().trim();
        }
        String type = descriptor.getSourceType().toLowerCase(Locale.ROOT).replace('_', ' ');
        return descriptor.getCategory().name().charAt(0)
                + descriptor.getCategory().name().substring(1).toLowerCase(Locale.ROOT) + " risk: " + type;
    }

    private static int severity(TriggerSignal signal, Urgency urgency) {
        if (signal instanceof SecurityTrigger && ((SecurityTrigger) signal).getSeverityScore() > 0) {
            return clamp((int) Math.ceil(((SecurityTrigger) signal).getSeverityScore() / 20.0), 1, 5);
        }
        switch (urgency) {
            case CRITICAL:
                return 5;
            case HIGH:
                return 4;
            case MEDIUM:
                return 3;
            default:
                return 2;
        }
    }

    private static int impactBase(Urgency urgency) {
        switch (urgency) {
            case CRITICAL:
                return 9;
            case HIGH:
                return 7;
            case MEDIUM:
                return 5;
            default:
                return 3;
        }
    }

    /** Confidentiality, integrity, availability; shaped by what the category usually threatens. */
    private static int[] ciaImpacts(TriggerSignal signal, int base) {
        switch (signal.getCategory()) {
            case SECURITY:
                boolean exfil = ((SecurityTrigger) signal).getType() == SecurityTrigger.Type.DATA_EXFILTRATION;
                return new int[]{clamp(exfil ? 10 : base, 1, 10), clamp(base - 1, 1, 10), clamp(base - 2, 1, 10)};
            case OPERATIONAL:
                return new int[]{clamp(base - 3, 1, 10), clamp(base - 2, 1, 10), clamp(base, 1, 10)};
            case COMPLIANCE:
                return new int[]{clamp(base, 1, 10), clamp(base - 1, 1, 10), clamp(base - 3, 1, 10)};
            default:
                return new int[]{clamp(base - 1, 1, 10), clamp(base - 1, 1, 10), clamp(base - 1, 1, 10)};
        }
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> out = new ArrayList<>(nullToEmpty(a));
        out.addAll(nullToEmpty(b));
        return out;
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values != null ? values : List.of();
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
