package app.lexrecall.core.review.domain;

import java.util.UUID;

public record CardPerformance(
        UUID cardId,
        long totalReviews,
        long correctReviews,
        int repetitions,
        double accuracy,
        boolean mastered
) {
    public static CardPerformance empty(UUID cardId) {
        return new CardPerformance(cardId, 0, 0, 0, 0.0, false);
    }
}
