package uk.gegc.learnerstate.features.learnerstate.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A labelled mistake recorded against a topic when a submission fails.
 */
public record ErrorPattern(
        String topic,
        String pattern,
        String questionId,
        Instant timestamp
) {
    public ErrorPattern {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(questionId, "questionId");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
