package uk.gegc.learnerstate.features.learnerstate.application;

import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;

import java.util.List;

/**
 * Read access to the external submissions log.
 */
public interface SubmissionHistorySource {

    /**
     * @return every submission of the learner ordered by timestamp ascending
     */
    List<SubmissionEvent> findByUserId(String userId);
}
