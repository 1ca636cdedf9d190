package com.pgcluster.ha.probe;

/**
 * Status endpoints probed on each node.
 */
public enum ProbeTarget {
    /** Patroni REST API root. */
    AGENT("DB", "/"),
    /** etcd v2 self statistics. */
    CONSENSUS("etcd", "/v2/stats/self");

    private final String label;
    private final String path;

    ProbeTarget(String label, String path) {
        this.label = label;
        this.path = path;
    }

    public String getLabel() {
        return label;
    }

    public String getPath() {
        return path;
    }
}
