package uk.gegc.learnerstate.features.learnerstate.application;

import java.util.Set;

/**
 * Looks up the topic set of a question when history events do not carry one.
 */
public interface TopicResolver {

    Set<String> resolveTopics(String questionId);
}
