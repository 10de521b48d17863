package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DedupeResult {

    DedupeAction action;
    String dedupeKey;
    /** 1.0 for an exact duplicate, the combined similarity for a merge, 0 otherwise. */
    double similarityScore;
    /** Risk that suppressed or absorbed the candidate; null for CREATE. */
    Long existingRiskId;
    String reason;

    public static DedupeResult create(String dedupeKey, String reason) {
        return DedupeResult.builder()
                .action(DedupeAction.CREATE)
                .dedupeKey(dedupeKey)
                .similarityScore(0.0)
                .reason(reason)
                .build();
    }
}
