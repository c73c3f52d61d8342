package uk.gegc.learnerstate.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration for centralized Clock management.
 * Provides a single source of time for the entire application,
 * in the same zone the streak tracker uses for calendar days.
 */
@Configuration
public class ClockConfig {

    /**
     * @param properties learner state settings carrying the configured zone
     * @return Clock instance configured with the learner state zone
     */
    @Bean
    public Clock clock(LearnerStateProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
