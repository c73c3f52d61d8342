package uk.gegc.learnerstate.features.learnerstate.infra.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.application.SubmissionHistorySource;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionEvent;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionLogEntry;
import uk.gegc.learnerstate.features.learnerstate.domain.repository.SubmissionLogEntryRepository;

import java.util.List;
import java.util.Set;

/**
 * Submissions carry no topics of their own; they are filled in from the question catalog.
 */
@Component
@RequiredArgsConstructor
public class JpaSubmissionHistorySource implements SubmissionHistorySource {

    private final SubmissionLogEntryRepository repository;

    @Override
    public List<SubmissionEvent> findByUserId(String userId) {
        return repository.findByUserIdOrderBySubmittedAtAscIdAsc(userId).stream()
                .map(this::toEvent)
                .toList();
    }

    private SubmissionEvent toEvent(SubmissionLogEntry entry) {
        return new SubmissionEvent(
                entry.getQuestionId(),
                Set.of(),
                Boolean.TRUE.equals(entry.getSuccess()),
                entry.getSubmittedAt(),
                entry.getErrorPattern(),
                entry.getQuality()
        );
    }
}
