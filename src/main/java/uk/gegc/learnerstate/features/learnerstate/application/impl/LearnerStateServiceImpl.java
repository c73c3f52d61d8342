package uk.gegc.learnerstate.features.learnerstate.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerHistoryReader;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerStateGateway;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerStateService;
import uk.gegc.learnerstate.features.learnerstate.application.StateRecalculator;
import uk.gegc.learnerstate.features.learnerstate.application.SubmissionPipeline;
import uk.gegc.learnerstate.features.learnerstate.application.dto.BulkRecalculationResult;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;
import uk.gegc.learnerstate.features.learnerstate.domain.model.VersionedLearnerState;
import uk.gegc.learnerstate.shared.config.LearnerStateProperties;
import uk.gegc.learnerstate.shared.exception.StateConflictException;
import uk.gegc.learnerstate.shared.exception.UpstreamUnavailableException;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

@Service
public class LearnerStateServiceImpl implements LearnerStateService {

    private static final Logger log = LoggerFactory.getLogger(LearnerStateServiceImpl.class);

    private final LearnerStateGateway gateway;
    private final LearnerHistoryReader historyReader;
    private final SubmissionPipeline submissionPipeline;
    private final StateRecalculator stateRecalculator;
    private final LearnerStateProperties properties;
    private final ThreadPoolTaskExecutor recalculationExecutor;
    private final Clock clock;

    public LearnerStateServiceImpl(
            LearnerStateGateway gateway,
            LearnerHistoryReader historyReader,
            SubmissionPipeline submissionPipeline,
            StateRecalculator stateRecalculator,
            LearnerStateProperties properties,
            @Qualifier("recalculationExecutor") ThreadPoolTaskExecutor recalculationExecutor,
            Clock clock
    ) {
        this.gateway = gateway;
        this.historyReader = historyReader;
        this.submissionPipeline = submissionPipeline;
        this.stateRecalculator = stateRecalculator;
        this.properties = properties;
        this.recalculationExecutor = recalculationExecutor;
        this.clock = clock;
    }

    @Override
    public LearnerState getState(String userId) {
        Optional<VersionedLearnerState> stored = load(userId);
        if (stored.isPresent()) {
            return stored.get().state();
        }
        List<SubmissionEvent> history = historyReader.readHistory(userId);
        if (history.isEmpty()) {
            return LearnerState.empty(Instant.now(clock));
        }
        log.debug("No stored learner state, serving recalculated view: userId={}, events={}", userId, history.size());
        return stateRecalculator.recalculate(userId, history);
    }

    @Override
    public LearnerState recalculateState(String userId) {
        // History is reread on every attempt.
        AtomicInteger events = new AtomicInteger();
        LearnerState stored = withRetry(userId, current -> {
            List<SubmissionEvent> history = historyReader.readHistory(userId);
            events.set(history.size());
            return stateRecalculator.recalculate(userId, history);
        });
        log.info("Learner state recalculated: userId={}, events={}, topics={}, reviews={}, streak={}",
                userId, events.get(), stored.mastery().size(), stored.reviews().size(), stored.streak());
        return stored;
    }

    @Override
    public LearnerState updateAfterSubmission(String userId, SubmissionEvent event) {
        SubmissionEvent normalized = submissionPipeline.normalize(historyReader.withTopics(event));

        LearnerState stored = withRetry(userId, current -> submissionPipeline.apply(current, normalized));
        log.info("Learner state updated: userId={}, questionId={}, success={}, topics={}, streak={}",
                userId, normalized.questionId(), normalized.success(), normalized.topics(), stored.streak());
        return stored;
    }

    @Override
    public BulkRecalculationResult recalculateAll(Collection<String> userIds) {
        Map<String, CompletableFuture<LearnerState>> futures = new LinkedHashMap<>();
        for (String userId : new LinkedHashSet<>(userIds)) {
            futures.put(userId, CompletableFuture.supplyAsync(() -> recalculateState(userId), recalculationExecutor));
        }

        Map<String, LearnerState> recalculated = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        futures.forEach((userId, future) -> {
            try {
                recalculated.put(userId, future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Bulk recalculation failed: userId={}", userId, cause);
                failures.put(userId, cause.getMessage());
            }
        });

        log.info("Bulk recalculation finished: requested={}, recalculated={}, failed={}",
                futures.size(), recalculated.size(), failures.size());
        return new BulkRecalculationResult(recalculated, failures);
    }

    /**
     * Loads the current snapshot, derives the next one and stores it conditionally.
     * A conflict reloads and recomputes; after the configured number of retries it is rethrown.
     */
    private LearnerState withRetry(String userId, Function<LearnerState, LearnerState> update) {
        int maxRetries = Math.max(0, properties.getMaxConflictRetries());
        for (int attempt = 0; ; attempt++) {
            Optional<VersionedLearnerState> current = load(userId);
            LearnerState base = current.map(VersionedLearnerState::state).orElseGet(() -> LearnerState.empty(Instant.EPOCH));
            Long expectedVersion = current.map(VersionedLearnerState::version).orElse(null);

            LearnerState next = update.apply(base);
            try {
                long version = store(userId, next, expectedVersion);
                log.debug("Learner state stored: userId={}, version={}, attempt={}", userId, version, attempt + 1);
                return next;
            } catch (StateConflictException e) {
                log.warn("Learner state optimistic lock conflict: userId={}, expectedVersion={}, attempt={}",
                        userId, expectedVersion, attempt + 1);
                if (attempt >= maxRetries) throw e;
                sleepBackoff(userId, attempt + 1);
            }
        }
    }

    private Optional<VersionedLearnerState> load(String userId) {
        try {
            return gateway.load(userId);
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Learner state storage unavailable for user " + userId, e);
        }
    }

    private long store(String userId, LearnerState state, Long expectedVersion) {
        try {
            return gateway.store(userId, state, expectedVersion);
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Learner state storage unavailable for user " + userId, e);
        }
    }

    private void sleepBackoff(String userId, int attempt) {
        long delay = properties.getRetryBackoffMs() * attempt;
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateConflictException(userId, "Interrupted while backing off after a write conflict", e);
        }
    }
}
