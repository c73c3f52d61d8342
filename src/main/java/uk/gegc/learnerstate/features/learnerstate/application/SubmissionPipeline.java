package uk.gegc.learnerstate.features.learnerstate.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;
import uk.gegc.learnerstate.shared.exception.ValidationException;

import java.time.LocalDate;
import java.util.Set;

/**
 * Applies one submission to a state snapshot: mastery, error patterns, review schedule, then streak.
 * Each step reads the snapshot produced by the previous one and nothing here touches storage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionPipeline {

    private final TopicNormalizer topicNormalizer;
    private final MasteryEstimator masteryEstimator;
    private final ErrorPatternTracker errorPatternTracker;
    private final ReviewScheduler reviewScheduler;
    private final StreakTracker streakTracker;

    /**
     * Validates the event and normalizes its topics.
     *
     * @throws ValidationException when the question id is blank, the timestamp is missing,
     *                             the quality is out of range or no usable topic remains
     */
    public SubmissionEvent normalize(SubmissionEvent event) {
        if (event == null) {
            throw new ValidationException("Submission event is required");
        }
        if (event.questionId() == null || event.questionId().isBlank()) {
            throw new ValidationException("Submission question id must not be blank");
        }
        if (event.timestamp() == null) {
            throw new ValidationException("Submission timestamp is required for question " + event.questionId());
        }
        if (event.quality() != null && (event.quality() < 0 || event.quality() > 5)) {
            throw new ValidationException("Review quality must be between 0 and 5, got " + event.quality());
        }
        Set<String> topics = topicNormalizer.normalize(event.topics());
        if (topics.isEmpty()) {
            throw new ValidationException("Submission for question " + event.questionId() + " has no valid topics");
        }
        return event.withTopics(topics);
    }

    public LearnerState apply(LearnerState state, SubmissionEvent rawEvent) {
        SubmissionEvent event = normalize(rawEvent);
        return applyNormalized(state, event);
    }

    /**
     * Same as {@link #apply} for an event that already went through {@link #normalize}.
     */
    LearnerState applyNormalized(LearnerState state, SubmissionEvent event) {
        LearnerState next = state.withMastery(
                masteryEstimator.updateMastery(state, event.topics(), event.success()));

        if (!event.success()) {
            next = next.withCommonErrors(errorPatternTracker.recordFailure(
                    next, event.topics(), event.errorPattern(), event.questionId(), event.timestamp()));
            next = next.withReviews(reviewScheduler.recordFailedReview(next, event.questionId(), event.timestamp()));
        } else {
            boolean isFirstSuccess = !next.reviews().containsKey(event.questionId());
            next = next.withReviews(reviewScheduler.scheduleReview(
                    next, event.questionId(), event.topics(), isFirstSuccess, event.timestamp(), event.quality()));
        }

        LocalDate day = streakTracker.activityDate(event.timestamp());
        if (next.lastSeen() != null && day.isBefore(next.lastSeen())) {
            log.debug("Out-of-order submission, streak left unchanged: questionId={}, day={}, lastSeen={}",
                    event.questionId(), day, next.lastSeen());
        } else {
            StreakTracker.StreakUpdate streak = streakTracker.updateStreak(next, day);
            next = next.withStreak(streak.streak(), streak.lastSeen());
        }

        if (event.timestamp().isAfter(next.updated())) {
            next = next.withUpdated(event.timestamp());
        }
        return next;
    }
}
