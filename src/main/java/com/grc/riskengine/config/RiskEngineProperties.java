package com.grc.riskengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunable thresholds for the risk pipeline, bound from {@code dynamic-risk.*}.
 * Defaults are the production baseline.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "dynamic-risk")
public class RiskEngineProperties {

    /** When false the batch cycle does nothing. */
    private boolean processingEnabled = true;

    private Decision decision = new Decision();
    private Dedupe dedupe = new Dedupe();
    private Cascade cascade = new Cascade();
    private Scoring scoring = new Scoring();
    private Batch batch = new Batch();
    private Sla sla = new Sla();
    private RateLimit rateLimit = new RateLimit();

    @Getter
    @Setter
    public static class Decision {
        private double autoApproveConfidence = 0.85;
        private double autoApproveComposite = 80;
        private double pendingConfidenceMin = 0.50;
        private double pendingComposite = 50;
        private double suppressConfidenceMax = 0.50;
        private double suppressCompositeMax = 40;
        private boolean kevShortcutEnabled = true;
        /** KEV shortcut: auto-approve when the business criticality index is at least this. */
        private double kevBusinessCriticalityBar = 70;
    }

    @Getter
    @Setter
    public static class Dedupe {
        private String tenant = "default";
        private Duration exactWindow = Duration.ofHours(24);
        private Duration mergeWindow = Duration.ofHours(48);
        private double titleSimilarityThreshold = 0.8;
        private double evidenceOverlapThreshold = 0.5;
        private int candidateLimit = 10;
    }

    @Getter
    @Setter
    public static class Cascade {
        private double confidenceThreshold = 0.7;
        /** Confidence multiplier applied at every hop. */
        private double hopDecay = 0.8;
        private int maxDepth = 3;
        /** Cascaded scores above this need review before they count. */
        private double approvalScoreThreshold = 10;
        /** Cascades weaker than this stop propagating. */
        private double minCascadedScore = 1.0;
    }

    @Getter
    @Setter
    public static class Scoring {
        private double ciaWeight = 0.35;
        private double dependencyWeight = 0.20;
        private double riskCorrelationWeight = 0.30;
        private double businessWeight = 0.10;
        private double technicalWeight = 0.03;
        private double historicalWeight = 0.02;
        private double highConfidenceRiskThreshold = 0.8;
        private double boostPerRisk = 3;
        private double maxBoost = 15;
        private double trendThreshold = 5;
        private Duration historyRetention = Duration.ofDays(30);
        private Duration incidentLookback = Duration.ofDays(30);
        private Fallback fallback = new Fallback();
    }

    @Getter
    @Setter
    public static class Fallback {
        private double confidence = 0.6;
        /** Bounded +/- noise applied by the rule-based predictor; 0 disables it. */
        private double noiseAmplitude = 5;
        /** Fixed seed for reproducible noise; random when unset. */
        private Long seed;
    }

    @Getter
    @Setter
    public static class Batch {
        private long cycleIntervalMs = 60_000;
        private long initialDelayMs = 10_000;
        private int batchSize = 50;
        private int workerThreads = 4;
        private Duration timeout = Duration.ofMinutes(15);
        private int maxAttempts = 3;
        private Duration lockWait = Duration.ofSeconds(30);
        private Duration pendingApprovalAlertAge = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Sla {
        private Duration target = Duration.ofMinutes(15);
        private Duration window = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int maxRisksPerServicePerDay = 50;
    }
}
