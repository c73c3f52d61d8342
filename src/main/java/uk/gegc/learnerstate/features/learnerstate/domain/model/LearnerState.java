package uk.gegc.learnerstate.features.learnerstate.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Compact model of what a learner knows, where they struggle and when they should be re-tested.
 *
 * <p>Instances are immutable. Every update produces a new snapshot, which is what lets
 * the write path retry a computation against freshly loaded state after a conflict.
 *
 * <p>A topic that is absent from {@link #mastery()} has never been observed. That is
 * different from a topic observed at 0.0, and {@link #masteryOf(String)} keeps the
 * distinction visible to callers.
 */
public record LearnerState(
        String version,
        Instant updated,
        Map<String, Double> mastery,
        Map<String, List<ErrorPattern>> commonErrors,
        Map<String, ReviewItem> reviews,
        int streak,
        LocalDate lastSeen
) {
    public static final String SCHEMA_VERSION = "1.0";

    public LearnerState {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(updated, "updated");
        if (streak < 0) {
            throw new IllegalArgumentException("streak must be non-negative");
        }
        mastery = freeze(mastery);
        commonErrors = freezeErrors(commonErrors);
        reviews = freeze(reviews);
    }

    /**
     * Creates the well-defined empty state for a learner with no recorded activity.
     */
    public static LearnerState empty(Instant now) {
        return new LearnerState(SCHEMA_VERSION, now, Map.of(), Map.of(), Map.of(), 0, null);
    }

    public OptionalDouble masteryOf(String topic) {
        Double value = mastery.get(topic);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public List<ErrorPattern> errorsFor(String topic) {
        return commonErrors.getOrDefault(topic, List.of());
    }

    public LearnerState withMastery(Map<String, Double> newMastery) {
        return new LearnerState(version, updated, newMastery, commonErrors, reviews, streak, lastSeen);
    }

    public LearnerState withCommonErrors(Map<String, List<ErrorPattern>> newErrors) {
        return new LearnerState(version, updated, mastery, newErrors, reviews, streak, lastSeen);
    }

    public LearnerState withReviews(Map<String, ReviewItem> newReviews) {
        return new LearnerState(version, updated, mastery, commonErrors, newReviews, streak, lastSeen);
    }

    public LearnerState withStreak(int newStreak, LocalDate newLastSeen) {
        return new LearnerState(version, updated, mastery, commonErrors, reviews, newStreak, newLastSeen);
    }

    public LearnerState withUpdated(Instant newUpdated) {
        return new LearnerState(version, newUpdated, mastery, commonErrors, reviews, streak, lastSeen);
    }

    private static <V> Map<String, V> freeze(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static Map<String, List<ErrorPattern>> freezeErrors(Map<String, List<ErrorPattern>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, List<ErrorPattern>> copy = new LinkedHashMap<>();
        source.forEach((topic, patterns) -> copy.put(topic, List.copyOf(patterns)));
        return Collections.unmodifiableMap(copy);
    }
}
