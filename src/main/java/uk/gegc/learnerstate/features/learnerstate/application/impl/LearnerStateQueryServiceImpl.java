package uk.gegc.learnerstate.features.learnerstate.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerHistoryReader;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerStateQueryService;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerStateService;
import uk.gegc.learnerstate.features.learnerstate.application.LearnerStateViews;
import uk.gegc.learnerstate.features.learnerstate.application.dto.LearnerSummary;
import uk.gegc.learnerstate.features.learnerstate.application.dto.TopicStatistics;
import uk.gegc.learnerstate.features.learnerstate.domain.model.ReviewItem;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
public class LearnerStateQueryServiceImpl implements LearnerStateQueryService {

    private final LearnerStateService learnerStateService;
    private final LearnerHistoryReader historyReader;
    private final LearnerStateViews views;
    private final Clock clock;

    @Override
    public TopicStatistics getTopicStatistics(String userId, String topic) {
        return views.getTopicStatistics(
                learnerStateService.getState(userId),
                historyReader.readHistory(userId),
                topic,
                Instant.now(clock));
    }

    @Override
    public List<ReviewItem> getDueReviews(String userId, Instant now) {
        return views.getDueReviews(learnerStateService.getState(userId), now);
    }

    @Override
    public LearnerSummary getSummary(String userId, LocalDate today) {
        return views.summarize(learnerStateService.getState(userId), today, Instant.now(clock));
    }
}
