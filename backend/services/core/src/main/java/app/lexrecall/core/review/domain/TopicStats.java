package app.lexrecall.core.review.domain;

import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.card.domain.Topic;

/**
 * Derived per-topic aggregate. Never authored directly; produced by the performance tracker.
 */
public record TopicStats(
        Subject subject,
        Topic topic,
        long totalReviews,
        long correctReviews,
        double accuracy,
        long reviews7Day,
        double accuracy7Day,
        double masteryScore,
        boolean mastered
) {
    public static TopicStats empty(Topic topic) {
        return new TopicStats(topic.subject(), topic, 0, 0, 0.0, 0, 0.0, 0.0, false);
    }
}
