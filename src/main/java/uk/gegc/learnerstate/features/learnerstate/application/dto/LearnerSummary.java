package uk.gegc.learnerstate.features.learnerstate.application.dto;

import java.time.LocalDate;
import java.util.List;

public record LearnerSummary(
        int topicsPracticed,
        double averageMastery,
        List<TopicMastery> strongestTopics,
        List<TopicMastery> weakestTopics,
        int reviewsDue,
        int currentStreak,
        LocalDate lastSeen
) {
    /**
     * @param displayName human-readable label, e.g. "Dynamic Programming"
     */
    public record TopicMastery(String topic, String displayName, double mastery) {
    }
}
