package com.pgcluster.ha.client;

import com.pgcluster.ha.command.CommandRunner;
import com.pgcluster.ha.command.CommandRunner.CommandResult;
import com.pgcluster.ha.config.ClusterProperties;
import com.pgcluster.ha.exception.CommandExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Restarts local systemd units that depend on the database backend list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServiceManager {

    private final ClusterProperties properties;
    private final CommandRunner commandRunner;

    public void restart(String unit) {
        CommandResult result = commandRunner.run(List.of("systemctl", "restart", unit));
        if (!result.isSuccess()) {
            throw new CommandExecutionException("systemctl restart " + unit, result.getExitCode(), result.getStderr());
        }
    }

    /**
     * Restart HAProxy so it picks up the edited backend list, then every service holding
     * database connections through it.
     */
    public void restartDatabaseDependentServices() {
        log.info("Restarting DB proxy service.");
        restart(properties.getHaproxy().getServiceName());

        log.info("Restarting DB-dependent services.");
        for (String unit : properties.getDependentServices()) {
            restart(unit);
        }
    }
}
