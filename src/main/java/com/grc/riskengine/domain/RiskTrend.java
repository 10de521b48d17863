package com.grc.riskengine.domain;

public enum RiskTrend {
    INCREASING, STABLE, DECREASING
}
