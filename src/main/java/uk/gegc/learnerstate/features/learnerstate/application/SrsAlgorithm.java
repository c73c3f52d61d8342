package uk.gegc.learnerstate.features.learnerstate.application;

import java.time.Instant;

public interface SrsAlgorithm {

    /**
     * Schedules a question that has no review item yet.
     *
     * @param firstSuccess whether this is the learner's first success on the question
     */
    SchedulingResult initialSchedule(boolean firstSuccess, Instant now);

    /**
     * @param quality optional recall quality (0..5); when null the ease factor is left unchanged
     */
    SchedulingResult applySuccess(int currentIntervalDays, double currentEaseFactor, Integer quality, Instant now);

    SchedulingResult applyFailure(double currentEaseFactor, Instant now);

    record SchedulingResult(
            int intervalDays,
            double easeFactor,
            Instant nextReviewAt
    ) {
    }
}
