package com.grc.riskengine.domain;

/** How a risk came to be associated with a service. */
public enum CascadingType {
    DIRECT, DEPENDENCY, CORRELATION
}
