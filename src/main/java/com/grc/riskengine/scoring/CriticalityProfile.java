package com.grc.riskengine.scoring;

import com.grc.riskengine.domain.CriticalityLevel;

/**
 * Fixed lookup tables derived from a service's declared criticality.
 */
public enum CriticalityProfile {

    CRITICAL(5, 5, 5, 1, 0.5, 99.99),
    HIGH(4, 4, 4, 4, 2, 99.9),
    MEDIUM(3, 3, 2, 24, 12, 99.5),
    LOW(2, 2, 1, 72, 24, 99.0);

    private final int businessFunction;
    private final int userImpact;
    private final int revenueImpact;
    private final double rtoHours;
    private final double rpoHours;
    private final double slaTargetPercent;

    CriticalityProfile(int businessFunction, int userImpact, int revenueImpact,
                       double rtoHours, double rpoHours, double slaTargetPercent) {
        this.businessFunction = businessFunction;
        this.userImpact = userImpact;
        this.revenueImpact = revenueImpact;
        this.rtoHours = rtoHours;
        this.rpoHours = rpoHours;
        this.slaTargetPercent = slaTargetPercent;
    }

    public static CriticalityProfile of(CriticalityLevel level) {
        if (level == null) return MEDIUM;
        switch (level) {
            case CRITICAL:
                return CRITICAL;
            case HIGH:
                return HIGH;
            case LOW:
                return LOW;
            default:
                return MEDIUM;
        }
    }

    /** 0–100. Also used as the business criticality index. */
    public double businessImpactScore() {
        return (businessFunction * 0.4 + userImpact * 0.3 + revenueImpact * 0.3) * 20;
    }

    /** 0–100; tighter recovery objectives and higher SLA targets score higher. */
    public double technicalScore() {
        double rtoScore = Math.max(0, 100 - rtoHours * 2);
        double rpoScore = Math.max(0, 100 - rpoHours * 4);
        return (rtoScore + rpoScore + slaTargetPercent) / 3;
    }

    public double getRtoHours() {
        return rtoHours;
    }

    public double getRpoHours() {
        return rpoHours;
    }

    public double getSlaTargetPercent() {
        return slaTargetPercent;
    }
}
