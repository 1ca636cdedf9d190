package com.pgcluster.ha.client;

import com.pgcluster.ha.command.CommandRunner;
import com.pgcluster.ha.command.CommandRunner.CommandResult;
import com.pgcluster.ha.config.ClusterProperties;
import com.pgcluster.ha.exception.CommandExecutionException;
import com.pgcluster.ha.util.NetworkUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client for cluster-wide Patroni actions, driven through {@code patronictl}.
 */
@Slf4j
@Component
public class PatroniClient {

    private final ClusterProperties properties;
    private final CommandRunner commandRunner;
    private final Pattern dsnPattern;

    public PatroniClient(ClusterProperties properties, CommandRunner commandRunner) {
        this.properties = properties;
        this.commandRunner = commandRunner;
        this.dsnPattern = Pattern.compile("host=(\\S+) port=" + properties.getPostgres().getPort());
    }

    /**
     * Address of the current primary according to the leader key in the DCS.
     *
     * @return The primary address, or empty when patronictl fails or reports no leader
     */
    public Optional<String> findPrimaryAddress() {
        CommandResult result = commandRunner.run(command("dsn"));
        if (!result.isSuccess()) {
            log.warn("patronictl dsn failed ({}): {}", result.getExitCode(), result.getStderr());
            return Optional.empty();
        }
        return parseDsn(result.getStdout());
    }

    /**
     * Extract the host from {@code host=192.0.2.1 port=5432}.
     */
    public Optional<String> parseDsn(String dsn) {
        if (dsn == null) {
            return Optional.empty();
        }
        Matcher matcher = dsnPattern.matcher(dsn);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Wipe and re-clone a replica from the primary. Patroni performs the resync in the
     * background; this returns once the request has been accepted.
     */
    public void reinitialize(String address) {
        String member = NetworkUtils.patroniMemberName(address);
        CommandResult result = commandRunner.run(command("reinit", "--force", properties.getPatroni().getScope(), member));
        requireSuccess("patronictl reinit " + member, result);
    }

    /**
     * Request a switchover with the given node as candidate. Completion is asynchronous.
     */
    public void switchover(String candidateAddress) {
        String member = NetworkUtils.patroniMemberName(candidateAddress);
        CommandResult result = commandRunner.run(command("switchover", "--force", "--candidate", member));
        requireSuccess("patronictl switchover --candidate " + member, result);
    }

    private List<String> command(String... args) {
        ClusterProperties.Patroni patroni = properties.getPatroni();
        List<String> command = new ArrayList<>(List.of(patroni.getCtlPath(), "-c", patroni.getConfigPath()));
        command.addAll(List.of(args));
        return command;
    }

    private static void requireSuccess(String description, CommandResult result) {
        if (!result.isSuccess()) {
            throw new CommandExecutionException(description, result.getExitCode(), result.getStderr());
        }
    }
}
