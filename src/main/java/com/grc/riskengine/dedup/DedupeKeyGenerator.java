package com.grc.riskengine.dedup;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.domain.RiskCandidate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds {@code tenant:service:category:fingerprint:day} keys. The fingerprint is the first
 * eight hex digits of a SHA-256 over the normalized title, actors, techniques and indicators.
 */
@Component
@RequiredArgsConstructor
public class DedupeKeyGenerator {

    private final RiskEngineProperties properties;
    private final Clock clock;

    public String generate(RiskCandidate candidate) {
        String day = LocalDate.now(clock.withZone(ZoneOffset.UTC)).toString();
        return String.join(":",
                properties.getDedupe().getTenant(),
                String.valueOf(candidate.getPrimaryServiceId()),
                candidate.getCategory().name().toLowerCase(Locale.ROOT),
                fingerprint(candidate),
                day);
    }

    static String fingerprint(RiskCandidate candidate) {
        String title = candidate.getTitle() != null ? candidate.getTitle().trim().toLowerCase(Locale.ROOT) : "";
        String material = String.join("|",
                title,
                normalized(candidate.getThreatActors()),
                normalized(candidate.getTechniques()),
                normalized(candidate.getIndicators()));
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Sorted so list order in the source signal does not change the key. */
    private static String normalized(List<String> values) {
        if (values == null) return "";
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .sorted()
                .collect(Collectors.joining(","));
    }
}
