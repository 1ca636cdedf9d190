package com.pgcluster.ha.model.status;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeRole {
    LEADER("leader"),
    SYNC_REPLICA("sync_replica"),
    ASYNC_REPLICA("async_replica"),
    UNKNOWN("unknown");

    private final String value;

    NodeRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
