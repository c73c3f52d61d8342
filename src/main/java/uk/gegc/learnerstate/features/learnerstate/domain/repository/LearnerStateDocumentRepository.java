package uk.gegc.learnerstate.features.learnerstate.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.learnerstate.features.learnerstate.domain.model.LearnerStateDocument;

public interface LearnerStateDocumentRepository extends JpaRepository<LearnerStateDocument, String> {
}
