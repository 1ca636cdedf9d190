package com.pgcluster.ha.client;

import com.pgcluster.ha.command.CommandRunner;
import com.pgcluster.ha.command.CommandRunner.CommandResult;
import com.pgcluster.ha.config.ClusterProperties;
import com.pgcluster.ha.exception.TopologyUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the live HAProxy backend table and edits the database backend list in haproxy.cfg.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HaproxyClient {

    private static final String SHOW_STAT = "show stat\n";
    private static final String AGGREGATE_FRONTEND = "FRONTEND";
    private static final String AGGREGATE_BACKEND = "BACKEND";

    private final ClusterProperties properties;
    private final CommandRunner commandRunner;

    /**
     * Server rows of the stats table, aggregate rows excluded.
     *
     * @throws TopologyUnavailableException if the stats socket cannot be read
     */
    public List<ProxyBackend> listBackends() {
        String socket = properties.getHaproxy().getStatsSocket();
        CommandResult result = commandRunner.run(List.of("socat", "stdio", socket), SHOW_STAT);
        if (!result.isSuccess() || result.getStdout().isBlank()) {
            throw new TopologyUnavailableException(
                    "HAProxy stats are not available on " + socket + ": " + result.getStderr());
        }
        return parseStats(result.getStdout());
    }

    /**
     * Parse {@code show stat} CSV output. The first line is the header, prefixed with "# ".
     * Only servers named after the configured backend prefix are returned; other proxies sharing
     * the HAProxy instance are ignored.
     */
    public List<ProxyBackend> parseStats(String csv) {
        List<ProxyBackend> backends = new ArrayList<>();
        String serverPrefix = properties.getHaproxy().getBackendPrefix() + "_";
        String[] lines = csv.split("\\R");
        if (lines.length == 0 || !lines[0].startsWith("#")) {
            log.warn("HAProxy stats output has no header line");
            return backends;
        }

        List<String> header = Arrays.asList(lines[0].substring(1).trim().split(","));
        int proxyIndex = header.indexOf("pxname");
        int serverIndex = header.indexOf("svname");
        int statusIndex = header.indexOf("status");
        if (proxyIndex < 0 || serverIndex < 0 || statusIndex < 0) {
            log.warn("HAProxy stats header is missing expected columns: {}", header);
            return backends;
        }

        for (int i = 1; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            String[] fields = lines[i].split(",", -1);
            if (fields.length <= Math.max(serverIndex, statusIndex)) {
                continue;
            }
            String serverName = fields[serverIndex];
            if (AGGREGATE_FRONTEND.equals(serverName) || AGGREGATE_BACKEND.equals(serverName)) {
                continue;
            }
            if (!serverName.startsWith(serverPrefix)) {
                log.debug("Skipping HAProxy server {} of proxy {}", serverName, fields[proxyIndex]);
                continue;
            }
            backends.add(ProxyBackend.builder()
                    .proxyName(fields[proxyIndex])
                    .serverName(serverName)
                    .status(fields[statusIndex])
                    .build());
        }
        return backends;
    }

    /**
     * The haproxy.cfg server line for a database node.
     */
    public String backendEntry(String address) {
        ClusterProperties.Haproxy haproxy = properties.getHaproxy();
        int pgPort = properties.getPostgres().getPort();
        return String.format("    server %s_%s_%d %s:%d maxconn %d check check-ssl port %d ca-file %s",
                haproxy.getBackendPrefix(), address, pgPort, address, pgPort,
                haproxy.getMaxConnections(), properties.getPatroni().getPort(), haproxy.getCaPath());
    }

    public void appendBackend(String address) {
        Path config = Path.of(properties.getHaproxy().getConfigPath());
        try {
            String existing = Files.exists(config) ? Files.readString(config, StandardCharsets.UTF_8) : "";
            String prefix = existing.isEmpty() || existing.endsWith("\n") ? "" : "\n";
            Files.writeString(config, prefix + backendEntry(address) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.info("Added backend for {} to {}", address, config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to update " + config, e);
        }
    }

    /**
     * Drop the server line for a node from haproxy.cfg.
     *
     * @return Number of lines removed
     */
    public int removeBackend(String address) {
        Path config = Path.of(properties.getHaproxy().getConfigPath());
        String entry = backendEntry(address).strip();
        try {
            List<String> lines = Files.readAllLines(config, StandardCharsets.UTF_8);
            List<String> kept = lines.stream()
                    .filter(line -> !line.strip().equals(entry))
                    .toList();
            int removed = lines.size() - kept.size();
            if (removed > 0) {
                Files.write(config, kept, StandardCharsets.UTF_8);
                log.info("Removed backend for {} from {}", address, config);
            } else {
                log.warn("No backend entry for {} found in {}", address, config);
            }
            return removed;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to update " + config, e);
        }
    }
}
