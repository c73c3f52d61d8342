package uk.gegc.learnerstate.features.learnerstate.infra.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerStateDocument;
import uk.gegc.learnerstate.features.learnerstate.domain.model.ReviewItem;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("LearnerStateDocumentMapper Tests")
class LearnerStateDocumentMapperTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private final LearnerStateDocumentMapper mapper = new LearnerStateDocumentMapper(new ObjectMapper());

    @Test
    @DisplayName("Should write dates as ISO strings and reviews as a list")
    void payloadShape() {
        LearnerState state = LearnerState.empty(T0)
                .withReviews(Map.of("q1", new ReviewItem("q1", Set.of("array"), T0, 1, 2.5)))
                .withStreak(1, LocalDate.of(2025, 3, 1));

        String payload = mapper.toPayload(state);

        assertThat(payload)
                .contains("\"updated\":\"2025-03-01T10:00:00Z\"")
                .contains("\"lastSeen\":\"2025-03-01\"")
                .contains("\"reviews\":[{\"questionId\":\"q1\"");
    }

    @Test
    @DisplayName("Should fill the document columns from the state")
    void appliesColumns() throws Exception {
        LearnerState state = LearnerState.empty(T0).withMastery(Map.of("array", 0.1));
        LearnerStateDocument document = new LearnerStateDocument();

        mapper.apply(document, state);

        assertEquals(LearnerState.SCHEMA_VERSION, document.getSchemaVersion());
        assertEquals(T0, document.getUpdatedAt());
        assertEquals(state, mapper.fromPayload(document.getPayload()));
    }

    @Test
    @DisplayName("Should tolerate documents missing optional sections")
    void readsSparsePayload() throws Exception {
        LearnerState state = mapper.fromPayload("{\"mastery\":{\"tree\":0.5},\"streak\":2}");

        assertEquals(LearnerState.SCHEMA_VERSION, state.version());
        assertEquals(Instant.EPOCH, state.updated());
        assertEquals(0.5, state.mastery().get("tree"));
        assertThat(state.reviews()).isEmpty();
        assertEquals(2, state.streak());
    }
}
