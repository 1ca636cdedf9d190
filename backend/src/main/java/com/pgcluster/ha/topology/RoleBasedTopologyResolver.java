package com.pgcluster.ha.topology;

import com.pgcluster.ha.config.ClusterProperties;
import com.pgcluster.ha.exception.RoleUnsupportedException;
import com.pgcluster.ha.model.status.ClusterTopology;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Picks the topology source matching this host's role.
 * A host running both services resolves through etcd.
 */
@Primary
@Component
@RequiredArgsConstructor
public class RoleBasedTopologyResolver implements TopologyResolver {

    private final ClusterProperties properties;
    private final ConsensusTopologyResolver consensusResolver;
    private final ProxyTopologyResolver proxyResolver;

    @Override
    public ClusterTopology resolve() {
        if (properties.isDatabaseNode()) {
            return consensusResolver.resolve();
        }
        if (properties.isClientNode()) {
            return proxyResolver.resolve();
        }
        throw new RoleUnsupportedException();
    }
}
