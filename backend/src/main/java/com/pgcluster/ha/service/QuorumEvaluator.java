package com.pgcluster.ha.service;

import com.pgcluster.ha.model.status.ClusterHealth;
import com.pgcluster.ha.model.status.ClusterVerdict;
import com.pgcluster.ha.model.status.ConsensusRole;
import com.pgcluster.ha.model.status.NodeRole;
import com.pgcluster.ha.model.status.NodeStatus;
import com.pgcluster.ha.model.status.RawAgentStatus;
import com.pgcluster.ha.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifies cluster health from the aggregated node statuses.
 * <p>
 * Checks run in a fixed order and can only raise the verdict: once DOWN, nothing lowers it.
 * Comparisons against a primary value that is unknown are skipped rather than failed.
 */
@Slf4j
@Service
public class QuorumEvaluator {

    public static final String ERROR_OUT_OF_SYNC = "Out of sync";
    public static final String ERROR_EXTRA_MASTER = "EXTRA MASTER";
    public static final String CONSENSUS_LOST = "cluster consensus lost";

    static final double MAX_ASYNC_LAG_MIB = 2.0;

    /**
     * Evaluate the cluster.
     *
     * @param primary  Status of the resolved primary; its address is null when no primary was found
     * @param replicas Status of every other member (all members when no primary was found)
     * @return Verdict with the node list it was derived from
     */
    public ClusterVerdict evaluate(NodeStatus primary, List<NodeStatus> replicas) {
        Evaluation evaluation = new Evaluation();

        RawAgentStatus primaryRaw = primary.getRawStatus();
        Long primaryLogPosition = primaryRaw != null ? primaryRaw.getLogPosition() : null;
        Long primaryTimeline = primaryRaw != null ? primaryRaw.getTimeline() : null;
        List<String> syncAddresses = primaryRaw != null ? primaryRaw.syncReplicaAddresses() : List.of();

        int memberCount = 1 + replicas.size();
        int majority = memberCount / 2;

        List<NodeStatus> nodes = new ArrayList<>();
        if (primary.getAddress() == null) {
            evaluation.down("No master found.");
        } else {
            nodes.add(primary);
        }
        nodes.addAll(replicas);

        if (!primary.isAlive()) {
            evaluation.raise(ClusterHealth.DOWN);
        }
        if (syncAddresses.isEmpty()) {
            // Writes are refused under synchronous replication without a sync standby
            evaluation.down("No synchronous replicas found.");
        }

        checkConsensus(evaluation, nodes, replicas.size(), majority);

        for (NodeStatus replica : replicas) {
            if (replica.getRole() == NodeRole.SYNC_REPLICA) {
                checkSyncReplica(evaluation, replica, primaryLogPosition);
            } else {
                checkAsyncReplica(evaluation, replica, primaryLogPosition, primaryTimeline);
            }

            if (replica.hasRawStatus() && replica.getRawStatus().reportsPrimary()) {
                // Only expected when a failover happens while the check is running
                String message = "MULTIPLE MASTERS DETECTED! PLEASE RUN THIS STATUS COMMAND AGAIN. "
                        + "IF THIS ERROR OCCURS AGAIN THEN STOP ALL USERS OF THIS CLUSTER AND CONTACT SUPPORT!";
                log.error(message);
                evaluation.diagnostics.add(message);
                replica.addError(ERROR_EXTRA_MASTER);
            }
        }

        return ClusterVerdict.builder()
                .status(evaluation.status)
                .nodes(nodes)
                .diagnostics(evaluation.diagnostics)
                .build();
    }

    private void checkConsensus(Evaluation evaluation, List<NodeStatus> nodes, int replicaCount, int majority) {
        int followers = 0;
        int leaders = 0;
        for (NodeStatus node : nodes) {
            if (node.getConsensusRole() == ConsensusRole.FOLLOWER) {
                followers++;
            } else if (node.getConsensusRole() == ConsensusRole.LEADER) {
                leaders++;
            }
        }

        if (leaders != 1) {
            evaluation.down("Expected to find 1 etcd leader, but found " + leaders + ", " + CONSENSUS_LOST + ".");
        }
        if (followers < majority) {
            evaluation.down("Insufficient etcd followers found, " + CONSENSUS_LOST + ".");
        } else if (followers < replicaCount) {
            evaluation.degraded("Missing one or more etcd followers.");
        }
    }

    private void checkSyncReplica(Evaluation evaluation, NodeStatus replica, Long primaryLogPosition) {
        Long replicaLogPosition = replica.getLogPosition();
        if (primaryLogPosition == null || replicaLogPosition == null) {
            return;
        }
        if (replicaLogPosition < primaryLogPosition) {
            log.error("Synchronous replica {} not in sync with master. "
                    + "Writes will be blocked until replica is in sync.", replica.getAddress());
            replica.addError(ERROR_OUT_OF_SYNC);
            evaluation.raise(ClusterHealth.DOWN);
        }
    }

    private void checkAsyncReplica(Evaluation evaluation, NodeStatus replica,
                                   Long primaryLogPosition, Long primaryTimeline) {
        if (primaryTimeline != null && !Objects.equals(replica.getTimeline(), primaryTimeline)) {
            log.warn("Asynchronous replica {} not on same timeline as master.", replica.getAddress());
            replica.addError(ERROR_OUT_OF_SYNC);
            evaluation.raise(ClusterHealth.DEGRADED);
        }

        Long replicaLogPosition = replica.getLogPosition();
        if (primaryLogPosition == null || replicaLogPosition == null) {
            return;
        }
        double lagMib = FormatUtils.toMebibytes(primaryLogPosition - replicaLogPosition);
        if (lagMib > MAX_ASYNC_LAG_MIB) {
            log.warn("Asynchronous replica {} appears to be lagging excessively.", replica.getAddress());
            replica.addError("Lag: " + FormatUtils.formatMebibytes(lagMib));
        }
    }

    private static final class Evaluation {
        private ClusterHealth status = ClusterHealth.HEALTHY;
        private final List<String> diagnostics = new ArrayList<>();

        void raise(ClusterHealth health) {
            status = status.worst(health);
        }

        void down(String message) {
            log.error(message);
            diagnostics.add(message);
            raise(ClusterHealth.DOWN);
        }

        void degraded(String message) {
            log.warn(message);
            diagnostics.add(message);
            raise(ClusterHealth.DEGRADED);
        }
    }
}
