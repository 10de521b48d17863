package com.grc.riskengine.domain;

public enum ApprovalStatus {
    PENDING, APPROVED, REJECTED
}
