package uk.gegc.learnerstate.features.learnerstate.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.application.dto.LearnerSummary;
import uk.gegc.learnerstate.features.learnerstate.application.dto.TopicStatistics;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.ReviewItem;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;
import uk.gegc.learnerstate.shared.config.LearnerStateProperties;
import uk.gegc.learnerstate.shared.exception.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Read-only projections over a loaded state snapshot.
 */
@Component
@RequiredArgsConstructor
public class LearnerStateViews {

    static final int SUMMARY_TOPIC_LIMIT = 3;

    private final LearnerStateProperties properties;
    private final TopicNormalizer topicNormalizer;
    private final StreakTracker streakTracker;

    /**
     * @return reviews due at {@code now}, most overdue first, ties by question id
     */
    public List<ReviewItem> getDueReviews(LearnerState state, Instant now) {
        return state.reviews().values().stream()
                .filter(item -> item.isDue(now))
                .sorted(Comparator.comparing((ReviewItem item) -> Duration.between(item.dueDate(), now))
                        .reversed()
                        .thenComparing(ReviewItem::questionId))
                .toList();
    }

    /**
     * @throws ValidationException when {@code topic} normalizes to nothing
     */
    public TopicStatistics getTopicStatistics(LearnerState state, List<SubmissionEvent> history, String topic, Instant now) {
        String canonical = topicNormalizer.normalize(topic);
        if (canonical == null) {
            throw new ValidationException("Topic '" + topic + "' has no usable characters");
        }
        long attempts = 0;
        long successes = 0;
        Set<String> solved = new HashSet<>();
        Instant lastPracticed = null;

        for (SubmissionEvent event : history) {
            if (event.timestamp() == null || !topicNormalizer.normalize(event.topics()).contains(canonical)) {
                continue;
            }
            attempts++;
            if (event.success()) {
                successes++;
                solved.add(event.questionId());
            }
            if (lastPracticed == null || event.timestamp().isAfter(lastPracticed)) {
                lastPracticed = event.timestamp();
            }
        }

        OptionalDouble mastery = state.masteryOf(canonical);
        double successRate = attempts == 0 ? 0.0 : (double) successes / attempts;

        return new TopicStatistics(
                canonical,
                attempts,
                successes,
                solved.size(),
                successRate,
                mastery,
                lastPracticed,
                state.errorsFor(canonical),
                needsReview(mastery, lastPracticed, now)
        );
    }

    public LearnerSummary summarize(LearnerState state, LocalDate today, Instant now) {
        Map<String, Double> mastery = state.mastery();
        double average = mastery.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        List<LearnerSummary.TopicMastery> strongest = mastery.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(SUMMARY_TOPIC_LIMIT)
                .map(e -> new LearnerSummary.TopicMastery(
                        e.getKey(), topicNormalizer.displayName(e.getKey()), e.getValue()))
                .toList();

        List<LearnerSummary.TopicMastery> weakest = mastery.entrySet().stream()
                .filter(e -> e.getValue() < properties.getReview().getMasteryThreshold())
                .sorted(Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(SUMMARY_TOPIC_LIMIT)
                .map(e -> new LearnerSummary.TopicMastery(
                        e.getKey(), topicNormalizer.displayName(e.getKey()), e.getValue()))
                .toList();

        return new LearnerSummary(
                mastery.size(),
                average,
                strongest,
                weakest,
                getDueReviews(state, now).size(),
                streakTracker.effectiveStreak(state, today),
                state.lastSeen()
        );
    }

    private boolean needsReview(OptionalDouble mastery, Instant lastPracticed, Instant now) {
        if (mastery.isEmpty()) {
            return false;
        }
        if (mastery.getAsDouble() < properties.getReview().getMasteryThreshold()) {
            return true;
        }
        return lastPracticed != null
                && Duration.between(lastPracticed, now).toDays() > properties.getReview().getStaleAfterDays();
    }
}
