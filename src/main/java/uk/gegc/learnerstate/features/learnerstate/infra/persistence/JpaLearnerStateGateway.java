package uk.gegc.learnerstate.features.learnerstate.infra.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerStateGateway;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerStateDocument;
import uk.gegc.learnerstate.features.learnerstate.domain.model.VersionedLearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.repository.LearnerStateDocumentRepository;
import uk.gegc.learnerstate.features.learnerstate.infra.mapping.LearnerStateDocumentMapper;
import uk.gegc.learnerstate.shared.exception.StateConflictException;
import uk.gegc.learnerstate.shared.exception.UpstreamUnavailableException;

import java.util.Objects;
import java.util.Optional;

/**
 * Stores learner state documents in a relational table guarded by a JPA {@code @Version} column.
 * Every store runs in its own transaction so a conflict is detected before the caller retries.
 */
@Slf4j
@Component
public class JpaLearnerStateGateway implements LearnerStateGateway {

    private final LearnerStateDocumentRepository repository;
    private final LearnerStateDocumentMapper mapper;
    private final TransactionTemplate transactionTemplate;

    public JpaLearnerStateGateway(
            LearnerStateDocumentRepository repository,
            LearnerStateDocumentMapper mapper,
            PlatformTransactionManager transactionManager
    ) {
        this.repository = repository;
        this.mapper = mapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<VersionedLearnerState> load(String userId) {
        Optional<LearnerStateDocument> document;
        try {
            document = repository.findById(userId);
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Failed to load learner state for user " + userId, e);
        }
        return document.map(this::toVersioned);
    }

    @Override
    public long store(String userId, LearnerState state, Long expectedVersion) {
        try {
            Long version = transactionTemplate.execute(status -> expectedVersion == null
                    ? insert(userId, state)
                    : update(userId, state, expectedVersion));
            return Objects.requireNonNull(version, "version");
        } catch (DataIntegrityViolationException e) {
            throw new StateConflictException(userId, "Learner state for user " + userId + " was created concurrently", e);
        } catch (OptimisticLockingFailureException e) {
            throw new StateConflictException(userId, "Learner state for user " + userId + " was modified concurrently", e);
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Failed to store learner state for user " + userId, e);
        }
    }

    private Long insert(String userId, LearnerState state) {
        if (repository.existsById(userId)) {
            throw new StateConflictException(userId, "Learner state for user " + userId + " already exists");
        }
        LearnerStateDocument document = new LearnerStateDocument();
        document.setUserId(userId);
        mapper.apply(document, state);
        LearnerStateDocument saved = repository.saveAndFlush(document);
        log.debug("Learner state document created: userId={}, version={}", userId, saved.getVersion());
        return saved.getVersion();
    }

    private Long update(String userId, LearnerState state, long expectedVersion) {
        LearnerStateDocument document = repository.findById(userId)
                .orElseThrow(() -> new StateConflictException(userId,
                        "Learner state for user " + userId + " no longer exists"));
        if (document.getVersion() == null || document.getVersion() != expectedVersion) {
            throw new StateConflictException(userId, "Learner state for user " + userId
                    + " is at version " + document.getVersion() + ", expected " + expectedVersion);
        }
        mapper.apply(document, state);
        LearnerStateDocument saved = repository.saveAndFlush(document);
        log.debug("Learner state document updated: userId={}, version={}", userId, saved.getVersion());
        return saved.getVersion();
    }

    private VersionedLearnerState toVersioned(LearnerStateDocument document) {
        try {
            return new VersionedLearnerState(mapper.fromPayload(document.getPayload()), document.getVersion());
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException("Stored learner state for user " + document.getUserId()
                    + " is unreadable", e);
        }
    }
}
