package com.pgcluster.ha.topology;

import com.pgcluster.ha.model.status.ClusterTopology;

/**
 * Source of the current primary and replica addresses.
 * <p>
 * Implementations read live state on every call and never cache: membership operations rely on
 * each call reflecting the cluster as it is now.
 */
public interface TopologyResolver {

    /**
     * Resolve the current topology.
     *
     * @return Topology with a possibly unknown primary
     * @throws com.pgcluster.ha.exception.TopologyUnavailableException if the data source cannot be read
     */
    ClusterTopology resolve();
}
