package com.grc.riskengine.domain;

/**
 * Queue priority of a risk update event. Lower rank is drained first.
 */
public enum EventPriority {
    CRITICAL(1),
    HIGH(2),
    MEDIUM(3),
    LOW(4);

    private final int rank;

    EventPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }
}
