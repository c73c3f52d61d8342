package uk.gegc.learnerstate.features.learnerstate.application;

import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.domain.model.ErrorPattern;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the most recent error patterns per topic, newest first.
 */
@Component
public class ErrorPatternTracker {

    public static final int MAX_PATTERNS_PER_TOPIC = 3;
    public static final String UNCLASSIFIED = "unclassified";

    public Map<String, List<ErrorPattern>> addErrorPattern(
            LearnerState state,
            String topic,
            String pattern,
            String questionId,
            Instant timestamp
    ) {
        Map<String, List<ErrorPattern>> errors = new LinkedHashMap<>(state.commonErrors());
        prepend(errors, topic, pattern, questionId, timestamp);
        return errors;
    }

    /**
     * Records the same pattern under every topic of a failed submission.
     */
    public Map<String, List<ErrorPattern>> recordFailure(
            LearnerState state,
            Collection<String> topics,
            String pattern,
            String questionId,
            Instant timestamp
    ) {
        Map<String, List<ErrorPattern>> errors = new LinkedHashMap<>(state.commonErrors());
        for (String topic : topics) {
            prepend(errors, topic, pattern, questionId, timestamp);
        }
        return errors;
    }

    private void prepend(
            Map<String, List<ErrorPattern>> errors,
            String topic,
            String pattern,
            String questionId,
            Instant timestamp
    ) {
        String label = pattern == null || pattern.isBlank() ? UNCLASSIFIED : pattern.trim();
        List<ErrorPattern> existing = errors.getOrDefault(topic, List.of());

        List<ErrorPattern> updated = new ArrayList<>(MAX_PATTERNS_PER_TOPIC);
        updated.add(new ErrorPattern(topic, label, questionId, timestamp));
        for (ErrorPattern previous : existing) {
            if (updated.size() == MAX_PATTERNS_PER_TOPIC) break;
            updated.add(previous);
        }
        errors.put(topic, updated);
    }
}
