package com.grc.riskengine.domain;

public enum Urgency {
    LOW, MEDIUM, HIGH, CRITICAL
}
