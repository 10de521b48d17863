package com.grc.riskengine.domain;

/**
 * Result of the decision thresholds. Each outcome fixes the initial lifecycle
 * state of the risk it produces.
 */
public enum DecisionOutcome {
    AUTO_APPROVE(LifecycleState.ACTIVE, ApprovalStatus.APPROVED),
    PENDING(LifecycleState.DRAFT, ApprovalStatus.PENDING),
    SUPPRESS(LifecycleState.SUPPRESSED, ApprovalStatus.REJECTED);

    private final LifecycleState initialState;
    private final ApprovalStatus initialApproval;

    DecisionOutcome(LifecycleState initialState, ApprovalStatus initialApproval) {
        this.initialState = initialState;
        this.initialApproval = initialApproval;
    }

    public LifecycleState getInitialState() {
        return initialState;
    }

    public ApprovalStatus getInitialApproval() {
        return initialApproval;
    }
}
