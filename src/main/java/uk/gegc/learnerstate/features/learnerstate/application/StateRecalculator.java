package uk.gegc.learnerstate.features.learnerstate.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;
import uk.gegc.learnerstate.shared.exception.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Rebuilds a learner state from raw submission history without looking at any stored state.
 *
 * <p>The result equals what incremental updates converge to when the same events are
 * applied in timestamp order. Events the write path would reject are skipped here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateRecalculator {

    private final SubmissionPipeline submissionPipeline;
    private final MasteryEstimator masteryEstimator;
    private final ErrorPatternTracker errorPatternTracker;
    private final ReviewScheduler reviewScheduler;
    private final StreakTracker streakTracker;

    public LearnerState recalculate(String userId, List<SubmissionEvent> history) {
        List<SubmissionEvent> events = normalizeAll(userId, history);
        events.sort(Comparator.comparing(SubmissionEvent::timestamp));

        Instant updated = events.isEmpty() ? Instant.EPOCH : events.get(events.size() - 1).timestamp();
        LearnerState state = LearnerState.empty(updated)
                .withMastery(masteryEstimator.initializeFromHistory(events));

        for (SubmissionEvent event : events) {
            if (event.success()) {
                boolean isFirstSuccess = !state.reviews().containsKey(event.questionId());
                state = state.withReviews(reviewScheduler.scheduleReview(
                        state, event.questionId(), event.topics(), isFirstSuccess, event.timestamp(), event.quality()));
            } else {
                state = state.withCommonErrors(errorPatternTracker.recordFailure(
                        state, event.topics(), event.errorPattern(), event.questionId(), event.timestamp()));
                state = state.withReviews(reviewScheduler.recordFailedReview(state, event.questionId(), event.timestamp()));
            }
        }

        TreeSet<LocalDate> activeDays = new TreeSet<>();
        events.forEach(event -> activeDays.add(streakTracker.activityDate(event.timestamp())));
        for (LocalDate day : activeDays) {
            StreakTracker.StreakUpdate streak = streakTracker.updateStreak(state, day);
            state = state.withStreak(streak.streak(), streak.lastSeen());
        }

        log.debug("Recalculated learner state: userId={}, events={}, topics={}, reviews={}, streak={}",
                userId, events.size(), state.mastery().size(), state.reviews().size(), state.streak());
        return state;
    }

    private List<SubmissionEvent> normalizeAll(String userId, List<SubmissionEvent> history) {
        List<SubmissionEvent> events = new ArrayList<>(history.size());
        for (SubmissionEvent raw : history) {
            try {
                events.add(submissionPipeline.normalize(raw));
            } catch (ValidationException e) {
                log.warn("Skipping invalid submission during recalculation: userId={}, questionId={}, reason={}",
                        userId, raw == null ? null : raw.questionId(), e.getMessage());
            }
        }
        return events;
    }
}
