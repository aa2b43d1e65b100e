package app.lexrecall.core.review.controller.dto;

import app.lexrecall.core.review.domain.Confidence;
import app.lexrecall.core.review.domain.ReviewResult;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record ReviewCardResponse(
        UUID reviewId,
        UUID cardId,
        UUID sessionId,
        Instant reviewedAt,
        int quality,
        Confidence confidence,
        boolean correct,
        double adjustedQuality,
        double easeFactor,
        int intervalDays,
        int repetitions,
        LocalDate dueDate,
        int sessionReviewCount,
        Map<Integer, Integer> nextIntervals
) {
    public static ReviewCardResponse from(ReviewResult result) {
        var r = result.record();
        var st = result.card().state();
        return new ReviewCardResponse(
                r.id(),
                r.cardId(),
                r.sessionId(),
                r.reviewedAt(),
                r.rawQuality(),
                r.confidence(),
                r.correct(),
                r.adjustedQuality(),
                st.easeFactor(),
                st.intervalDays(),
                st.repetitions(),
                st.dueDate(),
                result.session().reviewCount(),
                result.nextIntervals()
        );
    }
}
