package com.pgcluster.ha.service;

import com.pgcluster.ha.config.ClusterProperties;
import com.pgcluster.ha.model.status.ClusterTopology;
import com.pgcluster.ha.model.status.ClusterVerdict;
import com.pgcluster.ha.model.status.NodeRole;
import com.pgcluster.ha.model.status.NodeStatus;
import com.pgcluster.ha.topology.TopologyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Answers the cluster status query: resolve topology, probe every member, evaluate.
 */
@Slf4j
@Service
public class ClusterStatusService {

    public static final String ERROR_TIMED_OUT = "Status check timed out";

    private final TopologyResolver topologyResolver;
    private final NodeStatusAggregator aggregator;
    private final QuorumEvaluator evaluator;
    private final ClusterProperties properties;
    private final Executor probeExecutor;

    public ClusterStatusService(TopologyResolver topologyResolver, NodeStatusAggregator aggregator,
                                QuorumEvaluator evaluator, ClusterProperties properties,
                                @Qualifier("probeExecutor") Executor probeExecutor) {
        this.topologyResolver = topologyResolver;
        this.aggregator = aggregator;
        this.evaluator = evaluator;
        this.properties = properties;
        this.probeExecutor = probeExecutor;
    }

    public ClusterVerdict getClusterStatus() {
        ClusterTopology topology = topologyResolver.resolve();
        log.debug("Evaluating cluster status for {}", topology);
        if (!topology.hasPrimary()) {
            log.warn("No primary resolved, every member will be checked as a replica");
        }

        NodeStatus primary = aggregator.statusFor(topology.getPrimary(), NodeRole.LEADER);
        List<String> syncAddresses = primary.hasRawStatus()
                ? primary.getRawStatus().syncReplicaAddresses()
                : List.of();

        List<NodeStatus> replicas = probeReplicas(topology.getReplicas(), syncAddresses);
        return evaluator.evaluate(primary, replicas);
    }

    /**
     * Probe all replicas in parallel. Probes are independent, so ordering is restored from the
     * topology afterwards; a replica whose probe does not finish in time is reported as dead.
     */
    private List<NodeStatus> probeReplicas(List<String> addresses, List<String> syncAddresses) {
        List<CompletableFuture<NodeStatus>> futures = addresses.stream()
                .map(address -> CompletableFuture.supplyAsync(() -> aggregator.statusFor(
                        address,
                        syncAddresses.contains(address) ? NodeRole.SYNC_REPLICA : NodeRole.ASYNC_REPLICA),
                        probeExecutor))
                .toList();

        long overallTimeoutMs = properties.getTimeouts().getProbeMs() * 2L + 2000;
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(overallTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timeout waiting for replica status, using partial results");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for replica status");
        } catch (Exception e) {
            log.warn("Error during parallel replica status check: {}", e.getMessage());
        }

        List<NodeStatus> replicas = new ArrayList<>();
        for (int i = 0; i < addresses.size(); i++) {
            CompletableFuture<NodeStatus> future = futures.get(i);
            NodeStatus status = null;
            if (future.isDone() && !future.isCompletedExceptionally()) {
                status = future.join();
            }
            if (status == null) {
                status = NodeStatus.builder().address(addresses.get(i)).alive(false).build();
                status.addError(ERROR_TIMED_OUT);
            }
            replicas.add(status);
        }
        return replicas;
    }
}
