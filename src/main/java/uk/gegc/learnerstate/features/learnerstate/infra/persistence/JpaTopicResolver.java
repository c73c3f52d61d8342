package uk.gegc.learnerstate.features.learnerstate.infra.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.learnerstate.features.learnerstate.application.TopicResolver;
import uk.gegc.learnerstate.features.learnerstate.domain.model.QuestionTopics;
import uk.gegc.learnerstate.features.learnerstate.domain.repository.QuestionTopicsRepository;

import java.util.Set;

@Component
@RequiredArgsConstructor
public class JpaTopicResolver implements TopicResolver {

    private final QuestionTopicsRepository repository;

    @Override
    public Set<String> resolveTopics(String questionId) {
        return repository.findById(questionId)
                .map(QuestionTopics::getTopics)
                .map(Set::copyOf)
                .orElse(Set.of());
    }
}
