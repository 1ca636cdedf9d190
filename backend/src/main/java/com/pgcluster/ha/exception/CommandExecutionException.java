package com.pgcluster.ha.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A mutating external command (etcdctl, patronictl, systemctl) exited with a failure.
 */
@Getter
public class CommandExecutionException extends ClusterOperationException {

    public static final String CODE = "COMMAND_FAILED";

    private final int exitCode;

    public CommandExecutionException(String command, int exitCode, String stderr) {
        super("Command '" + command + "' failed with exit code " + exitCode
                + (stderr == null || stderr.isBlank() ? "" : ": " + stderr), CODE, HttpStatus.BAD_GATEWAY);
        this.exitCode = exitCode;
    }
}
