package uk.gegc.learnerstate.features.learnerstate.application.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uk.gegc.learnerstate.BaseUnitTest;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerHistoryReader;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerStateComponents;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerStateGateway;
import uk.gegc.learnerstate.features.learnerstate.application.SubmissionHistorySource;
import uk.gegc.learnerstate.features.learnerstate.application.TopicResolver;
import uk.gegc.learnerstate.features.learnerstate.application.dto.BulkRecalculationResult;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;
import uk.gegc.learnerstate.features.learnerstate.domain.model.VersionedLearnerState;
import uk.gegc.learnerstate.shared.config.LearnerStateProperties;
import uk.gegc.learnerstate.shared.exception.StateConflictException;
import uk.gegc.learnerstate.shared.exception.UpstreamUnavailableException;
import uk.gegc.learnerstate.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static uk.gegc.learnerstate.features.learnerstate.application.LearnerStateComponents.success;

@DisplayName("LearnerStateServiceImpl Tests")
class LearnerStateServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    @Mock
    private LearnerStateGateway gateway;
    @Mock
    private SubmissionHistorySource historySource;
    @Mock
    private TopicResolver topicResolver;

    private ThreadPoolTaskExecutor executor;
    private LearnerStateComponents components;
    private LearnerStateServiceImpl service;

    @BeforeEach
    void setUp() {
        LearnerStateProperties properties = new LearnerStateProperties();
        properties.setRetryBackoffMs(0);
        components = new LearnerStateComponents(properties);

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.initialize();

        service = new LearnerStateServiceImpl(
                gateway,
                new LearnerHistoryReader(historySource, topicResolver),
                components.pipeline,
                components.recalculator,
                properties,
                executor,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("getState: returns the stored state without writing")
    void getStateReturnsStored() {
        LearnerState stored = LearnerState.empty(NOW).withMastery(Map.of("array", 0.4));
        when(gateway.load("u1")).thenReturn(Optional.of(new VersionedLearnerState(stored, 2L)));

        assertSame(stored, service.getState("u1"));
        verify(gateway, never()).store(anyString(), any(), any());
        verifyNoInteractions(historySource);
    }

    @Test
    @DisplayName("getState: returns the empty state for an unknown learner without history")
    void getStateUnknownLearner() {
        when(gateway.load("u1")).thenReturn(Optional.empty());
        when(historySource.findByUserId("u1")).thenReturn(List.of());

        assertEquals(LearnerState.empty(NOW), service.getState("u1"));
        verify(gateway, never()).store(anyString(), any(), any());
    }

    @Test
    @DisplayName("getState: serves a transient recalculation when only history exists")
    void getStateFromHistory() {
        when(gateway.load("u1")).thenReturn(Optional.empty());
        when(historySource.findByUserId("u1")).thenReturn(List.of(
                new SubmissionEvent("q1", Set.of(), true, Instant.parse("2025-03-09T10:00:00Z"))));
        when(topicResolver.resolveTopics("q1")).thenReturn(Set.of("Hash Map"));

        LearnerState state = service.getState("u1");

        assertEquals(0.1, state.mastery().get("hash-table"), 1e-12);
        verify(gateway, never()).store(anyString(), any(), any());
    }

    @Test
    @DisplayName("updateAfterSubmission: creates state when none is stored")
    void updateCreatesState() {
        when(gateway.load("u1")).thenReturn(Optional.empty());
        when(gateway.store(eq("u1"), any(), isNull())).thenReturn(0L);

        LearnerState result = service.updateAfterSubmission("u1", success("q1", "array", "2025-03-10T09:00:00Z"));

        ArgumentCaptor<LearnerState> captor = ArgumentCaptor.forClass(LearnerState.class);
        verify(gateway).store(eq("u1"), captor.capture(), isNull());
        assertSame(result, captor.getValue());
        assertEquals(0.1, result.mastery().get("array"), 1e-12);
        assertEquals(1, result.streak());
    }

    @Test
    @DisplayName("updateAfterSubmission: reloads and reapplies after a conflict")
    void updateRetriesOnConflict() {
        LearnerState concurrent = components.pipeline.apply(LearnerState.empty(Instant.EPOCH),
                success("q0", "tree", "2025-03-10T08:00:00Z"));
        when(gateway.load("u1"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(new VersionedLearnerState(concurrent, 0L)));
        when(gateway.store(eq("u1"), any(), isNull()))
                .thenThrow(new StateConflictException("u1", "created concurrently"));
        when(gateway.store(eq("u1"), any(), eq(0L))).thenReturn(1L);

        LearnerState result = service.updateAfterSubmission("u1", success("q1", "array", "2025-03-10T09:00:00Z"));

        assertThat(result.mastery()).containsOnlyKeys("tree", "array");
        assertThat(result.reviews()).containsOnlyKeys("q0", "q1");
        verify(gateway, times(2)).load("u1");
    }

    @Test
    @DisplayName("updateAfterSubmission: rethrows the conflict once retries are exhausted")
    void updateGivesUpAfterRetries() {
        when(gateway.load("u1")).thenReturn(Optional.empty());
        when(gateway.store(eq("u1"), any(), isNull()))
                .thenThrow(new StateConflictException("u1", "conflict"));

        assertThrows(StateConflictException.class,
                () -> service.updateAfterSubmission("u1", success("q1", "array", "2025-03-10T09:00:00Z")));
        verify(gateway, times(4)).store(eq("u1"), any(), isNull());
    }

    @Test
    @DisplayName("updateAfterSubmission: rejects invalid events before touching storage")
    void updateRejectsInvalidEvent() {
        SubmissionEvent event = new SubmissionEvent("q1", Set.of("array"), true, null);

        assertThrows(ValidationException.class, () -> service.updateAfterSubmission("u1", event));
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("updateAfterSubmission: propagates storage outages without retrying")
    void updatePropagatesUpstreamFailure() {
        when(gateway.load("u1")).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(UpstreamUnavailableException.class,
                () -> service.updateAfterSubmission("u1", success("q1", "array", "2025-03-10T09:00:00Z")));
        verify(gateway, times(1)).load("u1");
        verify(gateway, never()).store(anyString(), any(), any());
    }

    @Test
    @DisplayName("recalculateState: stores the rebuilt state against the loaded version")
    void recalculateStoresWithVersion() {
        when(historySource.findByUserId("u1")).thenReturn(List.of(
                success("q1", "array", "2025-03-08T10:00:00Z"),
                success("q2", "array", "2025-03-09T10:00:00Z")));
        when(gateway.load("u1")).thenReturn(Optional.of(
                new VersionedLearnerState(LearnerState.empty(Instant.EPOCH), 5L)));
        when(gateway.store(eq("u1"), any(), eq(5L))).thenReturn(6L);

        LearnerState result = service.recalculateState("u1");

        assertEquals(0.19, result.mastery().get("array"), 1e-12);
        assertEquals(2, result.streak());
    }

    @Test
    @DisplayName("recalculateState: rereads history after a conflict")
    void recalculateRereadsHistoryOnConflict() {
        SubmissionEvent first = success("q1", "array", "2025-03-08T10:00:00Z");
        SubmissionEvent concurrent = success("q2", "tree", "2025-03-09T10:00:00Z");
        when(historySource.findByUserId("u1"))
                .thenReturn(List.of(first))
                .thenReturn(List.of(first, concurrent));
        when(gateway.load("u1"))
                .thenReturn(Optional.of(new VersionedLearnerState(LearnerState.empty(Instant.EPOCH), 5L)))
                .thenReturn(Optional.of(new VersionedLearnerState(LearnerState.empty(Instant.EPOCH), 6L)));
        when(gateway.store(eq("u1"), any(), eq(5L)))
                .thenThrow(new StateConflictException("u1", "modified concurrently"));
        when(gateway.store(eq("u1"), any(), eq(6L))).thenReturn(7L);

        LearnerState result = service.recalculateState("u1");

        ArgumentCaptor<LearnerState> captor = ArgumentCaptor.forClass(LearnerState.class);
        verify(gateway).store(eq("u1"), captor.capture(), eq(6L));
        assertSame(result, captor.getValue());
        assertThat(result.mastery()).containsOnlyKeys("array", "tree");
        assertThat(result.reviews()).containsOnlyKeys("q1", "q2");
        assertEquals(2, result.streak());
        verify(historySource, times(2)).findByUserId("u1");
    }

    @Test
    @DisplayName("recalculateAll: reports failures per learner")
    void recalculateAllCollectsFailures() {
        when(historySource.findByUserId("u1")).thenReturn(List.of(success("q1", "array", "2025-03-08T10:00:00Z")));
        when(historySource.findByUserId("u2")).thenThrow(new DataAccessResourceFailureException("timeout"));
        when(gateway.load("u1")).thenReturn(Optional.empty());
        when(gateway.store(eq("u1"), any(), isNull())).thenReturn(0L);

        BulkRecalculationResult result = service.recalculateAll(List.of("u1", "u2", "u1"));

        assertThat(result.recalculated()).containsOnlyKeys("u1");
        assertThat(result.failures()).containsOnlyKeys("u2");
    }
}
