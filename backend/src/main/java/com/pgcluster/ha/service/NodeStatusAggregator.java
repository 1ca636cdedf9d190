package com.pgcluster.ha.service;

import com.pgcluster.ha.model.status.ConsensusRole;
import com.pgcluster.ha.model.status.NodeRole;
import com.pgcluster.ha.model.status.NodeStatus;
import com.pgcluster.ha.model.status.RawAgentStatus;
import com.pgcluster.ha.model.status.RawConsensusStatus;
import com.pgcluster.ha.probe.StatusProbe;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Builds the normalized status record of one node from its Patroni and etcd probes.
 */
@Service
@RequiredArgsConstructor
public class NodeStatusAggregator {

    public static final String ERROR_NOT_RUNNING = "Node not running";
    public static final String ERROR_NO_DB_STATUS = "Could not retrieve DB status";
    public static final String ERROR_NO_ETCD_STATUS = "Could not retrieve etcd status";

    private final StatusProbe statusProbe;

    /**
     * Probe a node and describe it in the role the topology assigned to it.
     * <p>
     * The role is taken from the caller, not from the agent: the primary's replication list
     * decides which replicas are synchronous. The log position reported for the leader is its
     * write position; for replicas it is the replayed position.
     *
     * @param address      Node address; null (unresolved primary) yields a dead record without probing
     * @param expectedRole Role assigned by the caller
     */
    public NodeStatus statusFor(String address, NodeRole expectedRole) {
        NodeStatus node = NodeStatus.builder()
                .address(address)
                .alive(false)
                .build();

        Optional<RawAgentStatus> agent = statusProbe.probeAgent(address);
        Optional<RawConsensusStatus> consensus = statusProbe.probeConsensus(address);

        if (agent.isPresent()) {
            RawAgentStatus status = agent.get();
            node.setRawStatus(status);
            node.setRole(expectedRole);
            node.setLogPosition(expectedRole == NodeRole.LEADER
                    ? status.getLogPosition()
                    : status.getReplayedPosition());
            node.setTimeline(status.getTimeline());
            if (status.isRunning()) {
                node.setAlive(true);
            } else {
                node.addError(ERROR_NOT_RUNNING);
            }
        } else {
            node.setRole(NodeRole.UNKNOWN);
            node.addError(ERROR_NO_DB_STATUS);
        }

        if (consensus.isPresent()) {
            node.setConsensusRole(consensus.get().getRole());
        } else {
            node.setConsensusRole(ConsensusRole.DEAD);
            node.addError(ERROR_NO_ETCD_STATUS);
        }

        return node;
    }
}
