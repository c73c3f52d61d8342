package uk.gegc.learnerstate.features.learnerstate.application;

import uk.gegc.learnerstate.features.learnerstate.application.dto.LearnerSummary;
import uk.gegc.learnerstate.features.learnerstate.application.dto.TopicStatistics;
import uk.gegc.learnerstate.features.learnerstate.domain.model.ReviewItem;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public interface LearnerStateQueryService {

    TopicStatistics getTopicStatistics(String userId, String topic);

    List<ReviewItem> getDueReviews(String userId, Instant now);

    LearnerSummary getSummary(String userId, LocalDate today);
}
