package com.pgcluster.ha.model.status;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Primary and replica addresses as resolved at one point in time.
 * The primary may be unknown; the replica list never contains the primary.
 */
public final class ClusterTopology {

    private final String primary;
    private final List<String> replicas;

    public ClusterTopology(String primary, List<String> replicas) {
        this.primary = primary;
        this.replicas = replicas == null ? List.of() : replicas.stream()
                .filter(address -> !Objects.equals(address, primary))
                .distinct()
                .toList();
    }

    public String getPrimary() {
        return primary;
    }

    public List<String> getReplicas() {
        return replicas;
    }

    public boolean hasPrimary() {
        return primary != null;
    }

    public boolean isPrimary(String address) {
        return primary != null && primary.equals(address);
    }

    public boolean contains(String address) {
        return members().contains(address);
    }

    /**
     * Primary (when known) followed by the replicas.
     */
    public List<String> members() {
        List<String> members = new ArrayList<>();
        if (primary != null) {
            members.add(primary);
        }
        members.addAll(replicas);
        return members;
    }

    @Override
    public String toString() {
        return "ClusterTopology{primary=" + primary + ", replicas=" + replicas + "}";
    }
}
