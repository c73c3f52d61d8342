package uk.gegc.learnerstate.features.learnerstate.application.dto;

import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerState;

import java.util.Map;

/**
 * @param recalculated stored states by user id
 * @param failures     failure message by user id
 */
public record BulkRecalculationResult(
        Map<String, LearnerState> recalculated,
        Map<String, String> failures
) {
    public BulkRecalculationResult {
        recalculated = Map.copyOf(recalculated);
        failures = Map.copyOf(failures);
    }
}
