package com.pgcluster.ha.model.status;

/**
 * Overall cluster verdict. Declaration order is severity order; the worst value always wins.
 */
public enum ClusterHealth {
    HEALTHY(0),
    DEGRADED(1),
    DOWN(2);

    private final int code;

    ClusterHealth(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public ClusterHealth worst(ClusterHealth other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }
}
