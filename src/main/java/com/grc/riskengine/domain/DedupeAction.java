package com.grc.riskengine.domain;

public enum DedupeAction {
    CREATE, MERGE, SUPPRESS
}
