package com.pgcluster.ha.probe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgcluster.ha.config.ClusterProperties;
import com.pgcluster.ha.model.status.RawAgentStatus;
import com.pgcluster.ha.model.status.RawConsensusStatus;
import com.pgcluster.ha.model.status.ReplicationPeer;
import com.pgcluster.ha.util.NetworkUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches raw status from a node's Patroni agent and etcd member.
 * <p>
 * Unreachable nodes are expected during failures, so every failure (connection refused, timeout,
 * TLS error, bad payload) is logged and returned as an empty result. Payloads are converted to
 * typed records here; nothing past this class sees raw JSON.
 */
@Slf4j
@Component
public class StatusProbe {

    private final ClusterProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public StatusProbe(ClusterProperties properties, ObjectMapper objectMapper,
                       ProbeSslContextFactory sslContextFactory) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .sslContext(sslContextFactory.create())
                .connectTimeout(Duration.ofMillis(properties.getTimeouts().getProbeMs()))
                .build();
    }

    public Optional<RawAgentStatus> probeAgent(String address) {
        return probe(address, ProbeTarget.AGENT).map(this::parseAgentStatus);
    }

    public Optional<RawConsensusStatus> probeConsensus(String address) {
        return probe(address, ProbeTarget.CONSENSUS).map(this::parseConsensusStatus);
    }

    /**
     * Query one status endpoint of a node.
     *
     * @param address Node address; null yields an empty result without a request
     * @param target  Endpoint to query
     * @return The JSON payload, or empty when the node did not answer with a non-empty JSON object
     */
    public Optional<JsonNode> probe(String address, ProbeTarget target) {
        if (address == null) {
            return Optional.empty();
        }
        if (!NetworkUtils.isSafeHost(address)) {
            log.warn("Refusing to probe {} node with malformed address '{}'", target.getLabel(), address);
            return Optional.empty();
        }

        URI uri = buildUri(address, target);
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .timeout(Duration.ofMillis(properties.getTimeouts().getProbeMs()))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            // Patroni answers 503 on replicas for the root path but still returns the full status body
            JsonNode body = objectMapper.readTree(response.body());
            if (body == null || !body.isObject() || body.isEmpty()) {
                log.warn("Empty status of {} node from {} (HTTP {})", target.getLabel(), uri, response.statusCode());
                return Optional.empty();
            }
            return Optional.of(body);

        } catch (JsonProcessingException e) {
            log.warn("Unparseable status of {} node from {}: {}", target.getLabel(), uri, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Failed to get status of {} node from {}. Error was: {}", target.getLabel(), uri, e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while probing {} node at {}", target.getLabel(), uri);
            return Optional.empty();
        }
    }

    /**
     * Convert a Patroni status payload.
     * Primaries report {@code xlog.location}; replicas report {@code xlog.replayed_location}.
     */
    public RawAgentStatus parseAgentStatus(JsonNode payload) {
        JsonNode xlog = payload.path("xlog");

        List<ReplicationPeer> replication = new ArrayList<>();
        for (JsonNode peer : payload.path("replication")) {
            replication.add(ReplicationPeer.builder()
                    .peerAddress(textOrNull(peer, "client_addr"))
                    .syncState(textOrNull(peer, "sync_state"))
                    .build());
        }

        return RawAgentStatus.builder()
                .state(textOrNull(payload, "state"))
                .role(textOrNull(payload, "role"))
                .timeline(longOrNull(payload, "timeline"))
                .logPosition(longOrNull(xlog, "location"))
                .replayedPosition(longOrNull(xlog, "replayed_location"))
                .replication(replication)
                .build();
    }

    public RawConsensusStatus parseConsensusStatus(JsonNode payload) {
        return RawConsensusStatus.builder()
                .state(textOrNull(payload, "state"))
                .build();
    }

    private URI buildUri(String address, ProbeTarget target) {
        int port = switch (target) {
            case AGENT -> properties.getPatroni().getPort();
            case CONSENSUS -> properties.getEtcd().getClientPort();
        };
        return URI.create("https://" + NetworkUtils.urlHost(address) + ":" + port + target.getPath());
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToLong() ? value.asLong() : null;
    }
}
