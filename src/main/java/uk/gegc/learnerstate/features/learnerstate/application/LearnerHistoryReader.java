package uk.gegc.learnerstate.features.learnerstate.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;
import uk.gegc.learnerstate.shared.exception.UpstreamUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads a learner's submission history and fills in topics for events recorded without them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LearnerHistoryReader {

    private final SubmissionHistorySource historySource;
    private final TopicResolver topicResolver;

    public List<SubmissionEvent> readHistory(String userId) {
        List<SubmissionEvent> raw;
        try {
            raw = historySource.findByUserId(userId);
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Submission history unavailable for user " + userId, e);
        }

        List<SubmissionEvent> resolved = new ArrayList<>(raw.size());
        for (SubmissionEvent event : raw) {
            resolved.add(withTopics(event));
        }
        log.debug("Loaded submission history: userId={}, events={}", userId, resolved.size());
        return resolved;
    }

    /**
     * @return the event itself when it carries topics, otherwise a copy with the catalog topics of its question
     */
    public SubmissionEvent withTopics(SubmissionEvent event) {
        if (event == null || !event.topics().isEmpty() || event.questionId() == null) {
            return event;
        }
        Set<String> topics;
        try {
            topics = topicResolver.resolveTopics(event.questionId());
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Topic catalog unavailable for question " + event.questionId(), e);
        }
        return event.withTopics(topics);
    }
}
