package com.phillippitts.sendspin.config;

import com.phillippitts.sendspin.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the scheduler shared by clock sync requests and WebSocket pings.
 *
 * <p>Pool size is configured via {@link ThreadPoolProperties} ({@code threadpool.scheduler.*}).
 * Tasks are short sends, so a small pool suffices.
 */
@Configuration
public class ThreadPoolConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolConfig.class);

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the scheduler for periodic session work.
     *
     * <p>Errors in scheduled tasks are logged and the task keeps its schedule.
     *
     * @return Configured scheduler
     */
    @Bean(name = "sendspinScheduler")
    public TaskScheduler sendspinScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        scheduler.setErrorHandler(t -> LOG.error("Scheduled task failed", t));
        scheduler.initialize();
        return scheduler;
    }
}
