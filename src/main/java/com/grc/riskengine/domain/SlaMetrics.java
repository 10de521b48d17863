package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * SLA compliance over a rolling window: share of events completed within the target latency.
 */
@Value
@Builder
public class SlaMetrics {

    Instant windowStart;
    Instant windowEnd;
    long totalEvents;
    long completedWithinTarget;
    /** Percent, two decimals. 100 when the window is empty. */
    double complianceRate;
    double averageProcessingMillis;
    long processedEvents;
    long failedEvents;
    long pendingEvents;
}
