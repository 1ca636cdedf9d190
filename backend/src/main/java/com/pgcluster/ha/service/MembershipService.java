package com.pgcluster.ha.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pgcluster.ha.client.ConsensusClient;
import com.pgcluster.ha.client.HaproxyClient;
import com.pgcluster.ha.client.PatroniClient;
import com.pgcluster.ha.client.ServiceManager;
import com.pgcluster.ha.config.ClusterProperties;
import com.pgcluster.ha.exception.AlreadyMemberException;
import com.pgcluster.ha.exception.AlreadyPrimaryException;
import com.pgcluster.ha.exception.CannotReinitPrimaryException;
import com.pgcluster.ha.exception.CannotRemovePrimaryException;
import com.pgcluster.ha.exception.LastReplicaException;
import com.pgcluster.ha.exception.MemberNotFoundException;
import com.pgcluster.ha.exception.NodeNotRespondingException;
import com.pgcluster.ha.exception.NotAMemberException;
import com.pgcluster.ha.exception.TopologyUnavailableException;
import com.pgcluster.ha.exception.WrongRoleException;
import com.pgcluster.ha.model.dto.MembershipResult;
import com.pgcluster.ha.model.status.ClusterTopology;
import com.pgcluster.ha.probe.StatusProbe;
import com.pgcluster.ha.topology.TopologyResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Changes cluster membership: add, remove, reinitialise and promote nodes.
 * <p>
 * Every operation resolves the topology afresh and checks its preconditions before anything is
 * changed. There is no cross-node lock, so a failover racing with an operation can still make it
 * act on an outdated view; operators re-run the status check after each change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipService {

    private final TopologyResolver topologyResolver;
    private final StatusProbe statusProbe;
    private final ConsensusClient consensusClient;
    private final PatroniClient patroniClient;
    private final HaproxyClient haproxyClient;
    private final ServiceManager serviceManager;
    private final ClusterProperties properties;
    private final Sleeper sleeper;

    /**
     * Add a running database node to this client node's HAProxy backend list.
     */
    public MembershipResult addNode(String address) {
        if (properties.isDatabaseNode()) {
            throw new WrongRoleException("Database cluster nodes should be added to the cluster during install, "
                    + "by listing them in the cluster configuration.");
        }

        ClusterTopology topology = topologyResolver.resolve();
        if (topology.contains(address)) {
            throw new AlreadyMemberException(address);
        }

        if (statusProbe.probeAgent(address).isEmpty()) {
            throw new NodeNotRespondingException(address);
        }

        log.info("Updating DB proxy configuration.");
        haproxyClient.appendBackend(address);
        serviceManager.restartDatabaseDependentServices();

        return result(MembershipResult.OPERATION_ADD, address, true, "Node " + address + " added.");
    }

    /**
     * Remove a replica. On a database node the etcd member and its pg_hba entries are removed;
     * on a client node only the HAProxy backend is.
     */
    public MembershipResult removeNode(String address) {
        ClusterTopology topology = topologyResolver.resolve();

        if (topology.getReplicas().size() < 2) {
            throw new LastReplicaException();
        }
        if (topology.isPrimary(address)) {
            throw new CannotRemovePrimaryException(address);
        }

        if (properties.isDatabaseNode()) {
            String memberId = consensusClient.listMembers().get(address);
            if (memberId == null) {
                throw new MemberNotFoundException(address);
            }

            log.info("Removing etcd node {}", address);
            consensusClient.removeMember(memberId);

            log.info("Updating pg_hba to remove {}", address);
            ObjectNode dcsConfig = consensusClient.getDcsConfig();
            int removed = removeAccessEntries(dcsConfig, address);
            consensusClient.setDcsConfig(dcsConfig);
            log.info("Node {} removed ({} pg_hba entries dropped).", address, removed);
        } else {
            log.info("Updating DB proxy configuration.");
            if (haproxyClient.removeBackend(address) == 0) {
                return result(MembershipResult.OPERATION_REMOVE, address, false,
                        "No DB proxy backend entry found for " + address + ", nothing was changed.");
            }
            serviceManager.restartDatabaseDependentServices();
        }

        return result(MembershipResult.OPERATION_REMOVE, address, true, "Node " + address + " removed.");
    }

    /**
     * Ask Patroni to rebuild a replica from the primary. Returns once the request is accepted;
     * the data copy continues in the background.
     */
    public MembershipResult reinitNode(String address) {
        ClusterTopology topology = topologyResolver.resolve();

        if (topology.isPrimary(address)) {
            throw new CannotReinitPrimaryException(address);
        }
        if (!topology.contains(address)) {
            throw new NotAMemberException(address, "reinitialise");
        }
        if (!properties.isDatabaseNode()) {
            throw new WrongRoleException("Reinitialise can only be run from a DB node.");
        }

        log.info("Reinitialising DB node {}", address);
        patroniClient.reinitialize(address);
        log.info("DB node {} reinitialised.", address);

        return result(MembershipResult.OPERATION_REINIT, address, true,
                "Reinitialisation of " + address + " requested.");
    }

    /**
     * Switch the primary role to the given replica and wait for the topology to show it.
     * Not seeing the change in time is reported, not raised: the switchover may have completed
     * and been followed by another failover.
     */
    public MembershipResult promoteNode(String address) {
        ClusterTopology topology = topologyResolver.resolve();

        if (topology.isPrimary(address)) {
            throw new AlreadyPrimaryException(address);
        }
        if (!topology.contains(address)) {
            throw new NotAMemberException(address, "make master");
        }
        if (!properties.isDatabaseNode()) {
            throw new WrongRoleException("Set master can only be run from a DB node.");
        }

        log.info("Changing master to {}", address);
        patroniClient.switchover(address);

        String master = awaitPrimary(address);
        if (address.equals(master)) {
            log.info("Master changed to {}", address);
            return result(MembershipResult.OPERATION_PROMOTE, address, true, "Master changed to " + address + ".");
        }

        String message = "Master has not changed to " + address + ". Master is currently " + master + ". "
                + "This may indicate the master changed to the specified node and then changed again, "
                + "or that the change did not occur. Please check cluster health before retrying this operation.";
        log.warn(message);
        return result(MembershipResult.OPERATION_PROMOTE, address, false, message);
    }

    /**
     * Poll the topology until the expected primary shows up or the poll budget runs out.
     *
     * @return The last primary observed (null if none could be read)
     */
    private String awaitPrimary(String expected) {
        ClusterProperties.Promotion promotion = properties.getPromotion();
        String master = null;

        for (int poll = 1; poll <= promotion.getMaxPolls(); poll++) {
            try {
                master = topologyResolver.resolve().getPrimary();
            } catch (TopologyUnavailableException e) {
                log.warn("Topology unavailable while waiting for switchover: {}", e.getMessage());
                master = null;
            }

            if (expected.equals(master)) {
                return master;
            }

            log.info("Waiting for master to change to {}. Current master is {}.", expected, master);
            if (poll < promotion.getMaxPolls()) {
                try {
                    sleeper.sleep(promotion.getPollIntervalMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for master to change to {}", expected);
                    break;
                }
            }
        }
        return master;
    }

    /**
     * Drop every pg_hba entry granting access to the address from the DCS config, in place.
     * Entries are matched on " address/32 " so that 10.0.0.1 does not match 10.0.0.10.
     *
     * @return Number of entries removed
     */
    int removeAccessEntries(ObjectNode dcsConfig, String address) {
        JsonNode pgHba = dcsConfig.path("postgresql").path("pg_hba");
        if (!(pgHba instanceof ArrayNode entries)) {
            log.warn("DCS config has no postgresql.pg_hba list; nothing to remove for {}", address);
            return 0;
        }

        String exclusion = " " + address + "/32 ";
        int removed = 0;
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).asText().contains(exclusion)) {
                entries.remove(i);
                removed++;
            }
        }
        return removed;
    }

    private MembershipResult result(String operation, String address, boolean confirmed, String message) {
        return MembershipResult.builder()
                .operation(operation)
                .address(address)
                .confirmed(confirmed)
                .message(message)
                .build();
    }
}
