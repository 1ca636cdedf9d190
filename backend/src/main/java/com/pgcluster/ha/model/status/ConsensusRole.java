package com.pgcluster.ha.model.status;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a host's etcd member as reported by {@code /v2/stats/self}.
 */
public enum ConsensusRole {
    LEADER("leader"),
    FOLLOWER("follower"),
    /** Reachable but in any other state, e.g. an election in progress. */
    OTHER("other"),
    /** Status endpoint unreachable. */
    DEAD("dead");

    private final String value;

    ConsensusRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Map an etcd v2 state name ({@code StateLeader}, {@code StateFollower}, ...) to a role.
     */
    public static ConsensusRole fromState(String state) {
        if (state == null || state.isBlank()) {
            return DEAD;
        }
        return switch (state) {
            case "StateLeader" -> LEADER;
            case "StateFollower" -> FOLLOWER;
            default -> OTHER;
        };
    }
}
