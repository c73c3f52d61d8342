package uk.gegc.learnerstate.features.learnerstate.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.shared.config.LearnerStateProperties;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Counts consecutive calendar days with at least one submission.
 */
@Component
@RequiredArgsConstructor
public class StreakTracker {

    private final LearnerStateProperties properties;

    public StreakUpdate updateStreak(LearnerState state, LocalDate today) {
        LocalDate lastSeen = state.lastSeen();
        if (lastSeen == null) {
            return new StreakUpdate(1, today);
        }
        if (today.isBefore(lastSeen) || today.isEqual(lastSeen)) {
            return new StreakUpdate(state.streak(), lastSeen);
        }
        if (today.isEqual(lastSeen.plusDays(1))) {
            return new StreakUpdate(state.streak() + 1, today);
        }
        return new StreakUpdate(1, today);
    }

    /**
     * The streak as the learner would see it today: zero once a full day has been missed.
     */
    public int effectiveStreak(LearnerState state, LocalDate today) {
        LocalDate lastSeen = state.lastSeen();
        if (lastSeen == null || lastSeen.isBefore(today.minusDays(1))) {
            return 0;
        }
        return state.streak();
    }

    public LocalDate activityDate(Instant instant) {
        return LocalDate.ofInstant(instant, properties.zoneId());
    }

    public record StreakUpdate(int streak, LocalDate lastSeen) {
    }
}
