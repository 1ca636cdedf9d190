package com.pgcluster.ha.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Cluster settings for this host.
 * Every component receives this object through its constructor instead of reading global state.
 */
@Data
@ConfigurationProperties(prefix = "cluster")
public class ClusterProperties {

    /**
     * Services installed on this host.
     */
    private Set<ServiceRole> services = EnumSet.noneOf(ServiceRole.class);

    /**
     * Private address of this host, used for local-only etcd access.
     */
    private String privateIp;

    /**
     * Addresses of all database nodes declared at install time.
     */
    private List<String> nodes = new ArrayList<>();

    /**
     * Units restarted after the HAProxy backend list changes (HAProxy itself is always restarted first).
     */
    private List<String> dependentServices = new ArrayList<>();

    private Etcd etcd = new Etcd();
    private Patroni patroni = new Patroni();
    private Postgres postgres = new Postgres();
    private Haproxy haproxy = new Haproxy();
    private Timeouts timeouts = new Timeouts();
    private Promotion promotion = new Promotion();

    public boolean hasRole(ServiceRole role) {
        return services != null && services.contains(role);
    }

    public boolean isDatabaseNode() {
        return hasRole(ServiceRole.DATABASE);
    }

    public boolean isClientNode() {
        return hasRole(ServiceRole.CLIENT);
    }

    @Data
    public static class Etcd {
        private String binary = "etcdctl";
        private int clientPort = 2379;
        private int peerPort = 2380;
        private String localEndpoint = "https://127.0.0.1:2379";
        private String caPath = "/etc/etcd/ca.crt";
        private String rootPassword;
        private String patroniPassword;
        private String dcsConfigKey = "/db/postgres/config";
        private int authCheckAttempts = 5;
        private long authCheckDelayMs = 3000;
    }

    @Data
    public static class Patroni {
        private String ctlPath = "/opt/patroni/bin/patronictl";
        private String configPath = "/etc/patroni.conf";
        private String scope = "postgres";
        private int port = 8008;
    }

    @Data
    public static class Postgres {
        private int port = 5432;
        private String caPath = "/etc/pgcluster/ssl/postgresql_ca.crt";
    }

    @Data
    public static class Haproxy {
        private String serviceName = "haproxy";
        private String configPath = "/etc/haproxy/haproxy.cfg";
        private String statsSocket = "/var/run/haproxy.sock";
        private String caPath = "/etc/haproxy/ca.crt";
        private String backendPrefix = "postgresql";
        private int maxConnections = 100;
    }

    @Data
    public static class Timeouts {
        private int probeMs = 5000;
        private int commandMs = 30000;
    }

    @Data
    public static class Promotion {
        private int maxPolls = 30;
        private long pollIntervalMs = 1000;
    }
}
