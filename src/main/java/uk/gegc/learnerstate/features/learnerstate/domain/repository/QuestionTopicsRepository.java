package uk.gegc.learnerstate.features.learnerstate.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.learnerstate.features.learnerstate.domain.model.QuestionTopics;

public interface QuestionTopicsRepository extends JpaRepository<QuestionTopics, String> {
}
