package com.grc.riskengine.dedup;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Cached pointer from a dedupe key to the risk created for it.
 */
@Value
@Builder
@Jacksonized
public class DedupeRecord {

    String dedupeKey;
    Long riskId;
    Instant createdAt;
}
