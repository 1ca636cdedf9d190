package com.pgcluster.ha.topology;

import com.pgcluster.ha.client.ConsensusClient;
import com.pgcluster.ha.client.PatroniClient;
import com.pgcluster.ha.exception.TopologyUnavailableException;
import com.pgcluster.ha.model.status.ClusterTopology;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves topology on a database node: members from etcd, primary from the Patroni leader DSN.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsensusTopologyResolver implements TopologyResolver {

    private static final List<String> UNAVAILABLE_MARKERS = List.of("cluster is unavailable", "failed to list members");

    private final ConsensusClient consensusClient;
    private final PatroniClient patroniClient;

    @Override
    public ClusterTopology resolve() {
        String health = consensusClient.clusterHealth();
        if (UNAVAILABLE_MARKERS.stream().anyMatch(health::contains)) {
            throw new TopologyUnavailableException(
                    "Etcd is not responding on this node. Please retry this command on another DB cluster node.");
        }

        Map<String, String> members = consensusClient.listMembers();
        String primary = patroniClient.findPrimaryAddress().orElse(null);
        if (primary == null) {
            log.warn("Could not determine the current primary from the Patroni DSN");
        } else if (!members.containsKey(primary)) {
            log.warn("Primary {} is not a registered etcd member", primary);
        }

        List<String> replicas = new ArrayList<>();
        for (String address : members.keySet()) {
            if (!address.equals(primary)) {
                replicas.add(address);
            }
        }
        return new ClusterTopology(primary, replicas);
    }
}
