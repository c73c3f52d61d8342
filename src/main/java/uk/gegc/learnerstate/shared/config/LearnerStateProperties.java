package uk.gegc.learnerstate.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Configuration properties for the learner state engine.
 * These properties control conflict retries, calendar-day resolution
 * and the thresholds used by read-only views.
 */
@Data
@Component
@ConfigurationProperties(prefix = "learner-state")
@Validated
public class LearnerStateProperties {

    /**
     * Time zone used to derive activity dates from event instants.
     * Default: UTC
     */
    @NotBlank
    private String zone = "UTC";

    /**
     * How many times an update is reapplied after an optimistic write conflict
     * before the conflict is surfaced to the caller.
     * Default: 3
     */
    @Min(0)
    private int maxConflictRetries = 3;

    /**
     * Base backoff between conflict retries (in milliseconds), multiplied by the attempt number.
     * Default: 50
     */
    @Min(0)
    private long retryBackoffMs = 50;

    /**
     * Thresholds used by topic statistics and summaries
     */
    @Valid
    private Review review = new Review();

    /**
     * Thread pool settings for bulk recalculation
     */
    @Valid
    private Recalculation recalculation = new Recalculation();

    public ZoneId zoneId() {
        return ZoneId.of(zone == null || zone.isBlank() ? "UTC" : zone.trim());
    }

    @Data
    public static class Review {
        /**
         * Topics below this mastery are reported as needing review.
         * Default: 0.7
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double masteryThreshold = 0.7;

        /**
         * Topics not practiced for longer than this are reported as needing review.
         * Default: 7 days
         */
        @Min(0)
        private int staleAfterDays = 7;
    }

    @Data
    public static class Recalculation {
        @Min(1)
        private int corePoolSize = 2;
        @Min(1)
        private int maxPoolSize = 4;
        @Min(0)
        private int queueCapacity = 100;
    }
}
