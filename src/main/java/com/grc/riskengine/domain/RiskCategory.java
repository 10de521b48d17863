package com.grc.riskengine.domain;

public enum RiskCategory {
    SECURITY, OPERATIONAL, COMPLIANCE, STRATEGIC
}
