package com.pricestream.config;

import com.pricestream.alert.AlertConfig;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for the update pipeline.
 *
 * <p>Both keep accepting work after the context starts closing: the update scheduler
 * lets an in-flight cycle finish during shutdown, and that cycle still needs them.
 */
@Configuration
public class AsyncConfig {

    /** Runs one update cycle at a time; the scheduler's in-flight flag keeps the queue empty. */
    @Bean("priceUpdateExecutor")
    public ThreadPoolTaskExecutor priceUpdateExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("price-update-");
        executor.setAcceptTasksAfterContextClose(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /** Evaluates alert symbols in parallel. Saturation falls back to the cycle thread. */
    @Bean("alertEvaluationExecutor")
    public ThreadPoolTaskExecutor alertEvaluationExecutor(AlertConfig alertConfig) {
        int threads = Math.max(1, alertConfig.getEvaluationThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("alert-eval-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setAcceptTasksAfterContextClose(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
