package app.lexrecall.core.review.domain;

import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.card.domain.Topic;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable log entry written once per review. Subject and topic are copied from the card so the
 * performance aggregates can be rebuilt from the log alone; the resulting scheduling values are kept
 * for audit.
 */
public record ReviewRecord(
        UUID id,
        UUID cardId,
        UUID sessionId,
        Subject subject,
        Topic topic,
        Instant reviewedAt,
        int rawQuality,
        Confidence confidence,
        boolean correct,
        Integer timeTakenSeconds,
        double adjustedQuality,
        int repetitionsAfter,
        int intervalDaysAfter,
        double easeFactorAfter
) {
}
