package com.pgcluster.ha.config;

/**
 * Services a host can run within the cluster deployment.
 * The role set decides which topology source and which operations are available.
 */
public enum ServiceRole {
    /** Runs PostgreSQL under Patroni together with an etcd member. */
    DATABASE,
    /** Reaches the database only through the local HAProxy (manager nodes). */
    CLIENT,
    /** Message broker host; has no view of the database topology. */
    QUEUE
}
