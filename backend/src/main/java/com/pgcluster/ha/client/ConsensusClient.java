package com.pgcluster.ha.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pgcluster.ha.command.CommandRunner;
import com.pgcluster.ha.command.CommandRunner.CommandResult;
import com.pgcluster.ha.config.ClusterProperties;
import com.pgcluster.ha.exception.CommandExecutionException;
import com.pgcluster.ha.exception.ConsensusUnavailableException;
import com.pgcluster.ha.exception.TopologyUnavailableException;
import com.pgcluster.ha.util.NetworkUtils;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Client for the etcd v2 store backing Patroni, driven through {@code etcdctl}.
 */
@Slf4j
@Component
public class ConsensusClient {

    public static final String USER_ROOT = "root";
    public static final String USER_PATRONI = "patroni";

    private static final Set<String> SUPPORTED_USERS = Set.of(USER_ROOT, USER_PATRONI);
    private static final int EXIT_AUTH_REQUIRED = 4;

    private final ClusterProperties properties;
    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final Pattern memberPattern;

    private volatile Boolean authRequired;

    public ConsensusClient(ClusterProperties properties, CommandRunner commandRunner, ObjectMapper objectMapper) {
        this.properties = properties;
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
        // The id runs to the first colon. The IP may be IPv6, so anchor on the peer port followed by
        // clientURLs rather than stopping at the next colon.
        this.memberPattern = Pattern.compile(
                "^(?<id>[^:]+):.*peerURLs=https://(?<ip>.+):" + properties.getEtcd().getPeerPort() + " clientURLs");
    }

    /**
     * Output of {@code cluster-health} against the local member. Failures are not raised; the
     * caller inspects the text.
     */
    public String clusterHealth() {
        ClusterProperties.Etcd etcd = properties.getEtcd();
        CommandResult result = commandRunner.run(List.of(
                etcd.getBinary(),
                "--endpoint", etcd.getLocalEndpoint(),
                "--ca-file", etcd.getCaPath(),
                "cluster-health"));
        return result.getStdout() + "\n" + result.getStderr();
    }

    /**
     * Map of member IP to etcd member id, in listing order.
     *
     * @throws TopologyUnavailableException if the member list cannot be read
     */
    public Map<String, String> listMembers() {
        CommandResult result = run(List.of("member", "list"), false, null);
        if (!result.isSuccess()) {
            throw new TopologyUnavailableException(
                    "Failed to list etcd members: " + firstNonBlank(result.getStderr(), result.getStdout()));
        }
        return parseMemberList(result.getStdout());
    }

    /**
     * Parse {@code member list} output.
     * etcdctl of this generation ignores the JSON output flag for member listings, hence the regex.
     * <pre>
     * abc123def: name=etcd192_0_2_1 peerURLs=https://192.0.2.1:2380 clientURLs=https://192.0.2.1:2379 isLeader=false
     * </pre>
     */
    public Map<String, String> parseMemberList(String output) {
        Map<String, String> members = new LinkedHashMap<>();
        if (output == null) {
            return members;
        }
        for (String rawLine : output.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            Matcher matcher = memberPattern.matcher(line);
            if (!matcher.find()) {
                log.warn("Ignoring unrecognised etcd member line: {}", line);
                continue;
            }
            members.put(stripBrackets(matcher.group("ip")), matcher.group("id"));
        }
        return members;
    }

    /**
     * Remove a member, talking only to the local etcd endpoint as root.
     */
    public void removeMember(String memberId) {
        CommandResult result = run(List.of("member", "remove", memberId), true, USER_ROOT);
        requireSuccess("etcdctl member remove " + memberId, result);
    }

    /**
     * Read the Patroni DCS configuration blob.
     */
    public ObjectNode getDcsConfig() {
        String key = properties.getEtcd().getDcsConfigKey();
        CommandResult result = run(List.of("get", key), true, USER_ROOT);
        requireSuccess("etcdctl get " + key, result);
        try {
            JsonNode node = objectMapper.readTree(result.getStdout());
            if (!(node instanceof ObjectNode objectNode)) {
                throw new IllegalStateException("DCS config at " + key + " is not a JSON object");
            }
            return objectNode;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("DCS config at " + key + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Replace the Patroni DCS configuration blob as a whole.
     */
    public void setDcsConfig(ObjectNode config) {
        String key = properties.getEtcd().getDcsConfigKey();
        String json;
        try {
            json = objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise DCS config", e);
        }
        CommandResult result = run(List.of("set", key, json), true, USER_ROOT);
        requireSuccess("etcdctl set " + key, result);
    }

    /**
     * Determine whether etcd has authentication enabled.
     * <p>
     * {@code ls /} succeeds only when the cluster is up and auth is off; exit code 4 with a
     * user authentication error means auth is on. Anything else is retried with a fixed backoff,
     * allowing the cluster time to form. The answer is cached once known.
     *
     * @throws ConsensusUnavailableException if no answer was obtained within the attempts
     */
    public boolean requiresAuth() {
        Boolean known = authRequired;
        if (known != null) {
            return known;
        }

        log.info("Checking whether etcd requires auth.");
        ClusterProperties.Etcd etcd = properties.getEtcd();
        Retry retry = Retry.of("etcd-auth-check", RetryConfig.<CommandResult>custom()
                .maxAttempts(Math.max(1, etcd.getAuthCheckAttempts()))
                .waitDuration(Duration.ofMillis(etcd.getAuthCheckDelayMs()))
                .retryOnResult(result -> !result.isSuccess() && !isAuthError(result))
                .build());
        retry.getEventPublisher().onRetry(event -> log.debug("Etcd connection error (attempt {}/{})",
                event.getNumberOfRetryAttempts(), etcd.getAuthCheckAttempts()));

        CommandResult result = Retry.decorateSupplier(retry,
                () -> commandRunner.run(baseCommand(false, List.of("ls", "/")))).get();
        if (result.isSuccess()) {
            log.info("Etcd does not require auth.");
            authRequired = false;
            return false;
        }
        if (isAuthError(result)) {
            log.info("Etcd requires auth.");
            authRequired = true;
            return true;
        }
        log.debug("Last etcd connection error: {}", result.getStderr());
        throw new ConsensusUnavailableException("Etcd not up yet, this is likely the first node.");
    }

    // Relies on etcdctl not localising its error messages
    private static boolean isAuthError(CommandResult result) {
        return result.getExitCode() == EXIT_AUTH_REQUIRED
                && result.getStderr() != null && result.getStderr().contains("user authentication");
    }

    private CommandResult run(List<String> command, boolean localOnly, String username) {
        Map<String, String> environment = username != null && requiresAuth()
                ? Map.of("ETCDCTL_USERNAME", credentialsFor(username))
                : Map.of();
        return commandRunner.run(baseCommand(localOnly, command), null, environment);
    }

    private List<String> baseCommand(boolean localOnly, List<String> command) {
        ClusterProperties.Etcd etcd = properties.getEtcd();
        List<String> addresses = localOnly ? List.of(properties.getPrivateIp()) : properties.getNodes();
        String endpoints = addresses.stream()
                .map(address -> "https://" + NetworkUtils.urlHost(address) + ":" + etcd.getClientPort())
                .collect(Collectors.joining(","));

        List<String> full = new ArrayList<>(
                List.of(etcd.getBinary(), "--endpoints", endpoints, "--ca-file", etcd.getCaPath()));
        full.addAll(command);
        return full;
    }

    private String credentialsFor(String username) {
        if (!SUPPORTED_USERS.contains(username)) {
            throw new IllegalArgumentException(
                    "Cluster configuration only supports these etcd users: " + String.join(", ", SUPPORTED_USERS));
        }
        String password = USER_ROOT.equals(username)
                ? properties.getEtcd().getRootPassword()
                : properties.getEtcd().getPatroniPassword();
        return username + ":" + (password == null ? "" : password);
    }

    private static void requireSuccess(String description, CommandResult result) {
        if (!result.isSuccess()) {
            throw new CommandExecutionException(description, result.getExitCode(), result.getStderr());
        }
    }

    private static String stripBrackets(String ip) {
        if (ip.startsWith("[") && ip.endsWith("]")) {
            return ip.substring(1, ip.length() - 1);
        }
        return ip;
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }
}
