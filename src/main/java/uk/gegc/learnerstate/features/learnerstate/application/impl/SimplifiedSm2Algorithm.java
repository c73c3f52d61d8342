package uk.gegc.learnerstate.features.learnerstate.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.application.SrsAlgorithm;
import uk.gegc.learnerstate.features.learnerstate.domain.model.ReviewItem;
import uk.gegc.learnerstate.shared.exception.ValidationException;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * SM-2 without repetition counting: the interval grows by the ease factor on every success
 * and drops back to one day on a failure.
 */
@Component
public class SimplifiedSm2Algorithm implements SrsAlgorithm {

    private static final double DEFAULT_EASE_FACTOR = ReviewItem.MAX_EASE_FACTOR;
    private static final int AGAIN_INTERVAL_DAYS = 1;
    private static final int FIRST_SUCCESS_INTERVAL_DAYS = 1;
    private static final int UNSCHEDULED_SUCCESS_INTERVAL_DAYS = 3;
    // Roughly one hundred years.
    static final int MAX_INTERVAL_DAYS = 36_500;
    private static final int MIN_QUALITY = 0;
    private static final int MAX_QUALITY = 5;

    @Override
    public SchedulingResult initialSchedule(boolean firstSuccess, Instant now) {
        int intervalDays = firstSuccess ? FIRST_SUCCESS_INTERVAL_DAYS : UNSCHEDULED_SUCCESS_INTERVAL_DAYS;
        return new SchedulingResult(intervalDays, DEFAULT_EASE_FACTOR, now.plus(intervalDays, ChronoUnit.DAYS));
    }

    @Override
    public SchedulingResult applySuccess(int currentIntervalDays, double currentEaseFactor, Integer quality, Instant now) {
        double updatedEase = quality == null
                ? currentEaseFactor
                : calculateUpdatedEase(currentEaseFactor, validateQuality(quality));
        long grown = Math.round((double) currentIntervalDays * updatedEase);
        int intervalDays = (int) Math.min(MAX_INTERVAL_DAYS, Math.max(AGAIN_INTERVAL_DAYS, grown));
        return new SchedulingResult(intervalDays, updatedEase, now.plus(intervalDays, ChronoUnit.DAYS));
    }

    @Override
    public SchedulingResult applyFailure(double currentEaseFactor, Instant now) {
        return new SchedulingResult(AGAIN_INTERVAL_DAYS, currentEaseFactor, now.plus(AGAIN_INTERVAL_DAYS, ChronoUnit.DAYS));
    }

    private int validateQuality(int quality) {
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new ValidationException("Review quality must be between 0 and 5, got " + quality);
        }
        return quality;
    }

    private double calculateUpdatedEase(double currentEaseFactor, int qValue) {
        double updatedEase = currentEaseFactor
                + (0.1 - (5 - qValue) * (0.08 + (5 - qValue) * 0.02));
        return Math.min(ReviewItem.MAX_EASE_FACTOR, Math.max(updatedEase, ReviewItem.MIN_EASE_FACTOR));
    }
}
