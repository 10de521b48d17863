package com.grc.riskengine.domain;

public enum DependencyType {
    FUNCTIONAL, DATA, INFRASTRUCTURE, COMPLIANCE
}
