package com.pgcluster.ha.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;

/**
 * Validates the node's cluster configuration on startup.
 * Fails fast when the node cannot tell what it is; missing certificates are only warned about,
 * since the services that write them may not have run yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupValidator {

    private final ClusterProperties properties;

    @PostConstruct
    public void validate() {
        log.info("Validating cluster configuration...");

        validateRoles();
        validateDatabaseNode();
        validateCertificates();

        log.info("Cluster configuration validation complete");
    }

    private void validateRoles() {
        if (properties.getServices() == null || properties.getServices().isEmpty()) {
            throw new IllegalStateException(
                    "cluster.services must list at least one role for this node (database, client or queue)");
        }
        log.info("Node roles configured: {}", properties.getServices());
    }

    private void validateDatabaseNode() {
        if (!properties.isDatabaseNode()) {
            return;
        }

        if (properties.getPrivateIp() == null || properties.getPrivateIp().isBlank()) {
            throw new IllegalStateException("cluster.private-ip must be set on a database node");
        }
        if (properties.getNodes() == null || properties.getNodes().isEmpty()) {
            log.warn("cluster.nodes is empty. Etcd commands will only reach the local member.");
        }
    }

    private void validateCertificates() {
        if (properties.isDatabaseNode()) {
            checkReadable("etcd CA", properties.getEtcd().getCaPath());
        }
        if (properties.isClientNode()) {
            checkReadable("PostgreSQL CA", properties.getPostgres().getCaPath());
            checkReadable("HAProxy CA", properties.getHaproxy().getCaPath());
        }
    }

    private void checkReadable(String description, String path) {
        if (path == null || path.isBlank()) {
            log.warn("No {} path configured. TLS probes will use the JVM trust store.", description);
            return;
        }

        File file = new File(path);
        if (!file.exists()) {
            log.warn("{} file does not exist at: {}. " +
                    "Status checks will fail until it is installed.", description, path);
        } else if (!file.canRead()) {
            throw new IllegalStateException(description + " file exists but is not readable: " + path);
        } else {
            log.info("{} validated: {}", description, path);
        }
    }
}
