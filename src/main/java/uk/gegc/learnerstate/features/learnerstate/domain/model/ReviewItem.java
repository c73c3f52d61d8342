package uk.gegc.learnerstate.features.learnerstate.domain.model;

import uk.gegc.learnerstate.shared.exception.ValidationException;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * A question scheduled for spaced-repetition review.
 */
public record ReviewItem(
        String questionId,
        Set<String> topics,
        Instant dueDate,
        int intervalDays,
        double easeFactor
) {
    public static final double MIN_EASE_FACTOR = 1.3;
    public static final double MAX_EASE_FACTOR = 2.5;

    public ReviewItem {
        Objects.requireNonNull(questionId, "questionId");
        Objects.requireNonNull(dueDate, "dueDate");
        if (intervalDays < 1) {
            throw new ValidationException("Review interval must be at least 1 day, got " + intervalDays);
        }
        if (Double.isNaN(easeFactor) || easeFactor < MIN_EASE_FACTOR || easeFactor > MAX_EASE_FACTOR) {
            throw new ValidationException("Ease factor must be in [" + MIN_EASE_FACTOR + ", "
                    + MAX_EASE_FACTOR + "], got " + easeFactor);
        }
        topics = topics == null ? Set.of() : Set.copyOf(topics);
    }

    public boolean isDue(Instant now) {
        return !dueDate.isAfter(now);
    }
}
