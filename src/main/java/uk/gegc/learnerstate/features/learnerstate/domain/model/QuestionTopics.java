package uk.gegc.learnerstate.features.learnerstate.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Topic tags of a question as kept by the question catalog.
 */
@Entity
@Getter
@Setter
@Table(name = "question_topics")
public class QuestionTopics {

    @Id
    @Column(name = "question_id", length = 64, updatable = false, nullable = false)
    private String questionId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "question_topic_tag", joinColumns = @JoinColumn(name = "question_id"))
    @Column(name = "topic", length = 64, nullable = false)
    private Set<String> topics = new LinkedHashSet<>();
}
