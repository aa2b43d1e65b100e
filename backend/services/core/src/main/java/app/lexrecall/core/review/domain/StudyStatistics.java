package app.lexrecall.core.review.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the whole catalogue. {@code intervalDistribution} is keyed by bucket label in ascending
 * interval order.
 */
public record StudyStatistics(
        LocalDate asOf,
        long totalCards,
        long dueToday,
        long newCards,
        long masteredCards,
        long totalReviews,
        long correctReviews,
        double overallAccuracy,
        double accuracy7Day,
        double averageEaseFactor,
        Map<String, Long> intervalDistribution,
        List<SubjectStatistics> subjects
) {
}
