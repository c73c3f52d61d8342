package uk.gegc.learnerstate.features.learnerstate.application;

import uk.gegc.learnerstate.features.learnerstate.application.dto.BulkRecalculationResult;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;

import java.util.Collection;

public interface LearnerStateService {

    /**
     * Returns the stored state. A learner with nothing stored gets a state recalculated from
     * history, or the empty state when there is no history either. Never writes.
     */
    LearnerState getState(String userId);

    /**
     * Rebuilds the state from full history and stores it.
     */
    LearnerState recalculateState(String userId);

    /**
     * Applies one submission to the stored state, retrying on write conflicts.
     */
    LearnerState updateAfterSubmission(String userId, SubmissionEvent event);

    BulkRecalculationResult recalculateAll(Collection<String> userIds);
}
