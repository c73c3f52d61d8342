package uk.gegc.learnerstate.features.learnerstate.application.dto;

import uk.gegc.learnerstate.features.learnerstate.domain.model.ErrorPattern;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

/**
 * @param mastery        empty when the topic has never been observed
 * @param problemsSolved distinct questions on the topic answered correctly at least once
 * @param lastPracticed  null when the topic has no attempts
 */
public record TopicStatistics(
        String topic,
        long attempts,
        long successes,
        long problemsSolved,
        double successRate,
        OptionalDouble mastery,
        Instant lastPracticed,
        List<ErrorPattern> errorPatterns,
        boolean needsReview
) {
}
