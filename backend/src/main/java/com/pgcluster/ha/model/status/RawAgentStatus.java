package com.pgcluster.ha.model.status;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of a Patroni REST status payload.
 * Fields absent from the payload stay null (or empty for the replication list).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawAgentStatus {

    public static final String STATE_RUNNING = "running";

    private String state;
    private String role;
    private Long timeline;
    private Long logPosition;
    private Long replayedPosition;

    @Builder.Default
    private List<ReplicationPeer> replication = new ArrayList<>();

    public boolean isRunning() {
        return STATE_RUNNING.equals(state);
    }

    /**
     * Whether the node describes itself as the primary. Patroni reports {@code master} or
     * {@code primary} depending on version; older agents put it in {@code state}.
     */
    public boolean reportsPrimary() {
        return "master".equals(role) || "primary".equals(role) || "master".equals(state);
    }

    /**
     * Addresses of replicas this node (as primary) currently replicates to synchronously.
     */
    public List<String> syncReplicaAddresses() {
        if (replication == null) {
            return List.of();
        }
        return replication.stream()
                .filter(ReplicationPeer::isSync)
                .map(ReplicationPeer::getPeerAddress)
                .toList();
    }
}
