package com.pgcluster.ha.config;

import com.pgcluster.ha.service.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Infrastructure beans for the status and membership services.
 */
@Slf4j
@Configuration
public class ClusterConfig {

    /**
     * Thread pool used to probe replicas in parallel. Sized for a handful of database nodes;
     * a full queue makes the caller probe inline instead of dropping the check.
     */
    @Bean(name = "probeExecutor")
    public Executor probeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("status-probe-");
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();

        log.info("Probe executor initialized: corePoolSize={}, maxPoolSize={}, queueCapacity={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), executor.getQueueCapacity());

        return executor;
    }

    /**
     * Threads draining stdout and stderr of local commands, two per running command. There is no
     * queue: a reader that cannot start at once would leave its command blocked on a full pipe.
     */
    @Bean(name = "commandOutputExecutor")
    public Executor commandOutputExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("command-output-");
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);
        executor.initialize();

        log.info("Command output executor initialized: corePoolSize={}, maxPoolSize={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize());

        return executor;
    }

    @Bean
    public Sleeper sleeper() {
        return Thread::sleep;
    }
}
