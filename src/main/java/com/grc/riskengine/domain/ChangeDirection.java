package com.grc.riskengine.domain;

public enum ChangeDirection {
    INCREASE, DECREASE
}
