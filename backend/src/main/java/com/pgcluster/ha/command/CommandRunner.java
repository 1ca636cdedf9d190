package com.pgcluster.ha.command;

import com.pgcluster.ha.config.ClusterProperties;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs local commands (etcdctl, patronictl, systemctl, socat) with a bounded timeout.
 * Failures to start or finish a command are reported through the result with exit code -1,
 * never thrown.
 */
@Slf4j
@Component
public class CommandRunner {

    public static final int FAILED_TO_RUN = -1;

    private final int defaultTimeoutMs;
    private final Executor outputExecutor;

    public CommandRunner(ClusterProperties properties,
                         @Qualifier("commandOutputExecutor") Executor outputExecutor) {
        this.defaultTimeoutMs = properties.getTimeouts().getCommandMs();
        this.outputExecutor = outputExecutor;
    }

    public CommandResult run(List<String> command) {
        return run(command, null, Map.of(), defaultTimeoutMs);
    }

    public CommandResult run(List<String> command, String stdin) {
        return run(command, stdin, Map.of(), defaultTimeoutMs);
    }

    public CommandResult run(List<String> command, String stdin, Map<String, String> environment) {
        return run(command, stdin, environment, defaultTimeoutMs);
    }

    /**
     * Run a command and collect its output.
     *
     * @param command     Program and arguments
     * @param stdin       Text written to the process input, or null
     * @param environment Extra environment variables merged over the inherited environment
     * @param timeoutMs   Maximum time to wait for the process to exit
     */
    public CommandResult run(List<String> command, String stdin, Map<String, String> environment, int timeoutMs) {
        String display = command.get(0);
        Process process = null;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            if (environment != null) {
                builder.environment().putAll(environment);
            }
            process = builder.start();

            CompletableFuture<String> stdout = readAsync(process.getInputStream());
            CompletableFuture<String> stderr = readAsync(process.getErrorStream());

            try (OutputStream input = process.getOutputStream()) {
                if (stdin != null) {
                    input.write(stdin.getBytes(StandardCharsets.UTF_8));
                }
            }

            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Command {} timed out after {}ms", display, timeoutMs);
                return new CommandResult(FAILED_TO_RUN, "", "Command timed out after " + timeoutMs + "ms");
            }

            CommandResult result = new CommandResult(process.exitValue(), stdout.join(), stderr.join());
            log.debug("Command {} exited with {}", display, result.getExitCode());
            return result;

        } catch (IOException e) {
            if (process != null) {
                process.destroyForcibly();
            }
            log.error("Failed to run command {}: {}", display, e.getMessage());
            return new CommandResult(FAILED_TO_RUN, "", e.getMessage());
        } catch (RejectedExecutionException e) {
            if (process != null) {
                process.destroyForcibly();
            }
            log.error("No thread available to read output of command {}: {}", display, e.getMessage());
            return new CommandResult(FAILED_TO_RUN, "", "Command output reader unavailable: " + e.getMessage());
        } catch (CompletionException e) {
            log.error("Failed to read output of command {}: {}", display, e.getMessage());
            return new CommandResult(FAILED_TO_RUN, "", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            return new CommandResult(FAILED_TO_RUN, "", "Interrupted while waiting for " + display);
        }
    }

    private CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, outputExecutor);
    }

    @Data
    public static class CommandResult {
        private final int exitCode;
        private final String stdout;
        private final String stderr;

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
