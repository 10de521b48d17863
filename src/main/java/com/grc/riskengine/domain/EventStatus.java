package com.grc.riskengine.domain;

public enum EventStatus {
    PENDING, PROCESSING, COMPLETED, FAILED
}
