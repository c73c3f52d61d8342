package uk.gegc.learnerstate.features.learnerstate.application;

import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.VersionedLearnerState;
import uk.gegc.learnerstate.shared.exception.StateConflictException;
import uk.gegc.learnerstate.shared.exception.UpstreamUnavailableException;

import java.util.Optional;

/**
 * Keyed load/store of a learner's state with optimistic concurrency.
 * The engine depends on this port only and never on a particular document shape.
 */
public interface LearnerStateGateway {

    /**
     * @return the stored state and its version, or empty when nothing is stored for the learner
     * @throws UpstreamUnavailableException when storage cannot be reached
     */
    Optional<VersionedLearnerState> load(String userId);

    /**
     * Writes {@code state} if the stored version still equals {@code expectedVersion}.
     *
     * @param expectedVersion version returned by {@link #load}, or {@code null} when the learner
     *                        is expected to have no stored state yet
     * @return the new storage version
     * @throws StateConflictException       when another writer got there first
     * @throws UpstreamUnavailableException when storage cannot be reached
     */
    long store(String userId, LearnerState state, Long expectedVersion);
}
