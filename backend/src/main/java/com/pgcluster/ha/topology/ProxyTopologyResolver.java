package com.pgcluster.ha.topology;

import com.pgcluster.ha.client.HaproxyClient;
import com.pgcluster.ha.client.ProxyBackend;
import com.pgcluster.ha.model.status.ClusterTopology;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves topology on a client node from HAProxy's health checks.
 * The backend check only passes against the primary, so the single UP server is the primary.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProxyTopologyResolver implements TopologyResolver {

    private final HaproxyClient haproxyClient;

    @Override
    public ClusterTopology resolve() {
        String primary = null;
        List<String> replicas = new ArrayList<>();

        for (ProxyBackend backend : haproxyClient.listBackends()) {
            Optional<String> address = backend.address();
            if (address.isEmpty()) {
                log.debug("Skipping HAProxy server {} with unrecognised name", backend.getServerName());
                continue;
            }
            if (backend.isUp() && primary == null) {
                primary = address.get();
            } else {
                if (backend.isUp()) {
                    log.error("Multiple HAProxy backends report UP ({} and {}); keeping {} as primary",
                            primary, address.get(), primary);
                }
                replicas.add(address.get());
            }
        }
        return new ClusterTopology(primary, replicas);
    }
}
