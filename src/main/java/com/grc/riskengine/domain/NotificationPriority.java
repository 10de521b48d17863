package com.grc.riskengine.domain;

public enum NotificationPriority {
    LOW, MEDIUM, HIGH, CRITICAL
}
