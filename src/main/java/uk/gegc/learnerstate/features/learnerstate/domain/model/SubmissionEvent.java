package uk.gegc.learnerstate.features.learnerstate.domain.model;

import java.time.Instant;
import java.util.Set;

/**
 * One problem attempt as recorded by the submission log.
 *
 * @param errorPattern label of the mistake for failed attempts, may be null
 * @param quality      optional SM-2 recall quality (0..5), null when the caller has no such signal
 */
public record SubmissionEvent(
        String questionId,
        Set<String> topics,
        boolean success,
        Instant timestamp,
        String errorPattern,
        Integer quality
) {
    public SubmissionEvent {
        topics = topics == null ? Set.of() : Set.copyOf(topics);
    }

    public SubmissionEvent(String questionId, Set<String> topics, boolean success, Instant timestamp) {
        this(questionId, topics, success, timestamp, null, null);
    }

    public SubmissionEvent withTopics(Set<String> resolvedTopics) {
        return new SubmissionEvent(questionId, resolvedTopics, success, timestamp, errorPattern, quality);
    }
}
