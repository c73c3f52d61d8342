package uk.gegc.learnerstate.features.learnerstate.application;

import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-topic mastery as a bounded exponential moving estimate.
 *
 * <p>A success moves the score a tenth of the way towards 1.0, a failure removes 15% of it.
 * Topics that were never observed have no entry at all; they start from 0.0 on first observation.
 */
@Component
public class MasteryEstimator {

    static final double LEARNING_RATE = 0.1;
    static final double FORGETTING_RATE = 0.15;

    public Map<String, Double> updateMastery(LearnerState state, Collection<String> topics, boolean success) {
        Map<String, Double> mastery = new LinkedHashMap<>(state.mastery());
        for (String topic : topics) {
            double current = mastery.getOrDefault(topic, 0.0);
            mastery.put(topic, nextScore(current, success));
        }
        return mastery;
    }

    /**
     * Builds mastery from raw history.
     *
     * <p>For each topic the result is {@code sum(0.1 * s_i * prod_{j>i} f_j)} where {@code s_i} is 1 for a
     * success and {@code f_j} is 0.9 after a success and 0.85 after a failure. Weights shrink with every
     * later attempt on the topic, so old evidence decays geometrically. The sum is evaluated by folding
     * {@link #nextScore} over the topic's events in timestamp order, which keeps it bit-for-bit equal to
     * incremental updates applied in the same order.
     */
    public Map<String, Double> initializeFromHistory(List<SubmissionEvent> events) {
        List<SubmissionEvent> ordered = events.stream()
                .sorted(Comparator.comparing(SubmissionEvent::timestamp))
                .toList();

        Map<String, Double> mastery = new LinkedHashMap<>();
        for (SubmissionEvent event : ordered) {
            for (String topic : event.topics()) {
                double current = mastery.getOrDefault(topic, 0.0);
                mastery.put(topic, nextScore(current, event.success()));
            }
        }
        return mastery;
    }

    double nextScore(double current, boolean success) {
        double next = success
                ? current + LEARNING_RATE * (1.0 - current)
                : current - FORGETTING_RATE * current;
        return clamp(next);
    }

    private static double clamp(double value) {
        if (value < 0.0) return 0.0;
        if (value > 1.0) return 1.0;
        return value;
    }
}
