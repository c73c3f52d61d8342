package uk.gegc.learnerstate.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for bulk learner state recalculation.
 * Each task rebuilds one learner from history and shares no mutable state
 * with the others, so the pool can be sized freely.
 */
@Configuration
@Slf4j
public class RecalculationExecutorConfig {

    @Bean(name = "recalculationExecutor")
    public ThreadPoolTaskExecutor recalculationExecutor(LearnerStateProperties properties) {
        LearnerStateProperties.Recalculation settings = properties.getRecalculation();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("recalc-");

        // Caller runs the task if queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("Recalculation executor configured: corePoolSize={}, maxPoolSize={}, queueCapacity={}",
                settings.getCorePoolSize(), settings.getMaxPoolSize(), settings.getQueueCapacity());

        return executor;
    }
}
