package uk.gegc.learnerstate.features.learnerstate.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.learnerstate.features.learnerstate.domain.model.SubmissionLogEntry;

import java.util.List;

public interface SubmissionLogEntryRepository extends JpaRepository<SubmissionLogEntry, Long> {

    List<SubmissionLogEntry> findByUserIdOrderBySubmittedAtAscIdAsc(String userId);
}
