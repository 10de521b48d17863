package com.grc.riskengine.processing;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * What one event did, and which services now need a score recompute.
 */
@Value
@Builder
public class PipelineResult {

    public enum Outcome {
        CREATED, MERGED, SUPPRESSED_DUPLICATE, SUPPRESSED_LOW_SIGNAL, RATE_LIMITED, RECOMPUTE_ONLY
    }

    Outcome outcome;
    /** Risk created, merged into or referenced; null when nothing was written. */
    Long riskId;
    Set<Long> affectedServiceIds;

    static PipelineResult of(Outcome outcome, Long riskId, Set<Long> affectedServiceIds) {
        return PipelineResult.builder().outcome(outcome).riskId(riskId).affectedServiceIds(affectedServiceIds).build();
    }
}
