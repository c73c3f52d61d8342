package uk.gegc.learnerstate.features.learnerstate.domain.model;

/**
 * A learner state snapshot together with the storage version it was read at.
 */
public record VersionedLearnerState(LearnerState state, long version) {
}
