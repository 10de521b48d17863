package com.grc.riskengine.domain;

public enum EventSource {
    DEFENDER, SERVICENOW, JIRA, THREAT_INTEL, ASSET_MONITOR, MANUAL, SYSTEM
}
