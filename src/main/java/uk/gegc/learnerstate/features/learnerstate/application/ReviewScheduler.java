package uk.gegc.learnerstate.features.learnerstate.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.ReviewItem;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maintains the review schedule, one item per question.
 */
@Component
@RequiredArgsConstructor
public class ReviewScheduler {

    private final SrsAlgorithm srsAlgorithm;

    public Map<String, ReviewItem> scheduleReview(
            LearnerState state,
            String questionId,
            Collection<String> topics,
            boolean isFirstSuccess,
            Instant now
    ) {
        return scheduleReview(state, questionId, topics, isFirstSuccess, now, null);
    }

    /**
     * Schedules or advances the review of a successfully answered question.
     * A due date already later than the computed one is kept.
     *
     * @param quality optional recall quality (0..5) driving the ease factor
     */
    public Map<String, ReviewItem> scheduleReview(
            LearnerState state,
            String questionId,
            Collection<String> topics,
            boolean isFirstSuccess,
            Instant now,
            Integer quality
    ) {
        Map<String, ReviewItem> reviews = new LinkedHashMap<>(state.reviews());
        ReviewItem existing = reviews.get(questionId);

        SrsAlgorithm.SchedulingResult result = existing == null
                ? srsAlgorithm.initialSchedule(isFirstSuccess, now)
                : srsAlgorithm.applySuccess(existing.intervalDays(), existing.easeFactor(), quality, now);

        Instant dueDate = result.nextReviewAt();
        if (existing != null && existing.dueDate().isAfter(dueDate)) {
            dueDate = existing.dueDate();
        }

        reviews.put(questionId, new ReviewItem(
                questionId,
                Set.copyOf(topics),
                dueDate,
                result.intervalDays(),
                result.easeFactor()
        ));
        return reviews;
    }

    /**
     * Resets a scheduled question to a one-day interval. Unscheduled questions are left alone.
     */
    public Map<String, ReviewItem> recordFailedReview(LearnerState state, String questionId, Instant now) {
        ReviewItem existing = state.reviews().get(questionId);
        if (existing == null) {
            return state.reviews();
        }
        SrsAlgorithm.SchedulingResult result = srsAlgorithm.applyFailure(existing.easeFactor(), now);

        Map<String, ReviewItem> reviews = new LinkedHashMap<>(state.reviews());
        reviews.put(questionId, new ReviewItem(
                questionId,
                existing.topics(),
                result.nextReviewAt(),
                result.intervalDays(),
                result.easeFactor()
        ));
        return reviews;
    }
}
