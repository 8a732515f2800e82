package ch.doodleduel.roomcore.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for task scheduling.
 *
 * <p>Provides the {@link TaskScheduler} used by:
 * <ul>
 *   <li>the detached stale room pass after startup (StaleRoomReaper)</li>
 *   <li>the drawing and rating deadline timers of open room sessions (RoomSession)</li>
 * </ul>
 */
@Configuration
public class SchedulingConfig {

    /**
     * Creates a task scheduler with a small thread pool.
     *
     * <p>Configuration:
     * <ul>
     *   <li>Pool size: {@code doodleduel.scheduler.pool-size} threads (default: 2)</li>
     *   <li>Thread name prefix: "doodleduel-scheduler-" for easier debugging</li>
     *   <li>Daemon threads</li>
     * </ul>
     *
     * @return configured task scheduler
     */
    @Bean
    public TaskScheduler taskScheduler(@Value("${doodleduel.scheduler.pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("doodleduel-scheduler-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
