package uk.gegc.learnerstate.features.learnerstate.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.domain.model.ErrorPattern;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerStateDocument;
import uk.gegc.learnerstate.features.learnerstate.domain.model.ReviewItem;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Converts between {@link LearnerState} and the JSON payload kept in {@link LearnerStateDocument}.
 * Reviews are stored as a list ordered by question id; the in-memory map is rebuilt on read.
 */
@Component
public class LearnerStateDocumentMapper {

    private final ObjectMapper objectMapper;

    public LearnerStateDocumentMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void apply(LearnerStateDocument document, LearnerState state) {
        document.setPayload(toPayload(state));
        document.setSchemaVersion(state.version());
        document.setUpdatedAt(state.updated());
    }

    public String toPayload(LearnerState state) {
        try {
            return objectMapper.writeValueAsString(toDocumentPayload(state));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize learner state", e);
        }
    }

    public LearnerState fromPayload(String payload) throws JsonProcessingException {
        return toState(objectMapper.readValue(payload, StatePayload.class));
    }

    private StatePayload toDocumentPayload(LearnerState state) {
        Map<String, List<ErrorPayload>> errors = new LinkedHashMap<>();
        state.commonErrors().forEach((topic, patterns) -> errors.put(topic, patterns.stream()
                .map(p -> new ErrorPayload(p.topic(), p.pattern(), p.questionId(), p.timestamp()))
                .toList()));

        List<ReviewPayload> reviews = state.reviews().values().stream()
                .sorted((a, b) -> a.questionId().compareTo(b.questionId()))
                .map(r -> new ReviewPayload(r.questionId(), new TreeSet<>(r.topics()), r.dueDate(),
                        r.intervalDays(), r.easeFactor()))
                .toList();

        return new StatePayload(
                state.version(),
                state.updated(),
                state.mastery(),
                errors,
                reviews,
                state.streak(),
                state.lastSeen()
        );
    }

    private LearnerState toState(StatePayload payload) {
        Map<String, List<ErrorPattern>> errors = new LinkedHashMap<>();
        if (payload.commonErrors() != null) {
            payload.commonErrors().forEach((topic, patterns) -> errors.put(topic, patterns.stream()
                    .map(p -> new ErrorPattern(p.topic(), p.pattern(), p.questionId(), p.timestamp()))
                    .toList()));
        }

        Map<String, ReviewItem> reviews = new LinkedHashMap<>();
        if (payload.reviews() != null) {
            for (ReviewPayload r : payload.reviews()) {
                reviews.put(r.questionId(), new ReviewItem(r.questionId(), r.topics(), r.dueDate(),
                        r.intervalDays(), r.easeFactor()));
            }
        }

        return new LearnerState(
                payload.version() == null ? LearnerState.SCHEMA_VERSION : payload.version(),
                payload.updated() == null ? Instant.EPOCH : payload.updated(),
                payload.mastery(),
                errors,
                reviews,
                payload.streak(),
                payload.lastSeen()
        );
    }

    public record StatePayload(
            String version,
            Instant updated,
            Map<String, Double> mastery,
            Map<String, List<ErrorPayload>> commonErrors,
            List<ReviewPayload> reviews,
            int streak,
            LocalDate lastSeen
    ) {
    }

    public record ErrorPayload(String topic, String pattern, String questionId, Instant timestamp) {
    }

    public record ReviewPayload(String questionId, Set<String> topics, Instant dueDate, int intervalDays, double easeFactor) {
    }
}
