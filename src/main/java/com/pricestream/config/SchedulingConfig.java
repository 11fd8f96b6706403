package com.pricestream.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduling infrastructure shared by the update scheduler, the heartbeat sweep and the
 * rate-limit window purge.
 */
@Configuration
public class SchedulingConfig {

    /**
     * Task scheduler for {@code @Scheduled} methods. Named {@code taskScheduler} so it wins
     * over the SockJS scheduler the WebSocket support registers. Ticks only hand work off,
     * so a small pool is enough.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("stream-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
