package com.matcast.server.config;

import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for the hub's periodic work: the heartbeat sweep, the broker
 * liveness check and broker reconnect attempts. All of it is short and
 * non-blocking, so a small pool is enough.
 *
 * Configurable via: {@code matcast.scheduler.pool-size}
 */
@Configuration
public class SchedulerConfig {

    @Value("${matcast.scheduler.pool-size:4}")
    private int poolSize;

    @Value("${matcast.scheduler.await-termination-seconds:5}")
    private int awaitTermination;

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("hub-sched-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(awaitTermination);
        scheduler.setErrorHandler(t -> {
            // Log but don't kill the pool; one failed sweep must not stop the next
            LoggerFactory.getLogger(SchedulerConfig.class).error("Unhandled scheduler error", t);
        });
        return scheduler;
    }
}
