package uk.gegc.learnerstate.features.learnerstate.application;

import uk.gegc.learnerstate.features.learnerstate.application.impl.SimplifiedSm2Algorithm;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;
import uk.gegc.learnerstate.shared.config.LearnerStateProperties;

import java.time.Instant;
import java.util.Set;

/**
 * Wires the pure learner state components by hand for unit tests.
 */
public final class LearnerStateComponents {

    public final LearnerStateProperties properties;
    public final TopicNormalizer topicNormalizer = new TopicNormalizer();
    public final MasteryEstimator masteryEstimator = new MasteryEstimator();
    public final ErrorPatternTracker errorPatternTracker = new ErrorPatternTracker();
    public final ReviewScheduler reviewScheduler = new ReviewScheduler(new SimplifiedSm2Algorithm());
    public final StreakTracker streakTracker;
    public final SubmissionPipeline pipeline;
    public final StateRecalculator recalculator;
    public final LearnerStateViews views;

    public LearnerStateComponents() {
        this(new LearnerStateProperties());
    }

    public LearnerStateComponents(LearnerStateProperties properties) {
        this.properties = properties;
        this.streakTracker = new StreakTracker(properties);
        this.pipeline = new SubmissionPipeline(topicNormalizer, masteryEstimator, errorPatternTracker,
                reviewScheduler, streakTracker);
        this.recalculator = new StateRecalculator(pipeline, masteryEstimator, errorPatternTracker,
                reviewScheduler, streakTracker);
        this.views = new LearnerStateViews(properties, topicNormalizer, streakTracker);
    }

    public static SubmissionEvent success(String questionId, String topic, String timestamp) {
        return new SubmissionEvent(questionId, Set.of(topic), true, Instant.parse(timestamp));
    }

    public static SubmissionEvent failure(String questionId, String topic, String timestamp, String pattern) {
        return new SubmissionEvent(questionId, Set.of(topic), false, Instant.parse(timestamp), pattern, null);
    }
}
