package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ProcessingCycleSummary {

    String cycleId;
    Instant startedAt;
    Instant finishedAt;
    int claimed;
    int processed;
    int failed;
    int retried;
    int timedOut;
    int servicesRecomputed;
    int notificationsEmitted;
}
