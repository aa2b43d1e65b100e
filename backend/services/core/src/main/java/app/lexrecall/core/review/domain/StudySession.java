package app.lexrecall.core.review.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Bounded sequence of reviews. Counters are bumped inside the review transaction; the derived scores
 * are filled in when the session is closed.
 */
public record StudySession(
        UUID id,
        Instant startedAt,
        Instant endedAt,
        SessionStatus status,
        int reviewCount,
        int correctCount,
        int confidenceTotal,
        long timeTakenSeconds,
        Double accuracy,
        Double avgConfidence,
        Double qualityScore
) {
    public static StudySession start(UUID id, Instant now) {
        return new StudySession(id, now, null, SessionStatus.ACTIVE, 0, 0, 0, 0L, null, null, null);
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public StudySession withReview(boolean correct, Confidence confidence, Integer secondsTaken) {
        return new StudySession(
                id,
                startedAt,
                endedAt,
                status,
                reviewCount + 1,
                correctCount + (correct ? 1 : 0),
                confidenceTotal + confidence.score(),
                timeTakenSeconds + (secondsTaken == null ? 0 : secondsTaken),
                accuracy,
                avgConfidence,
                qualityScore
        );
    }

    public StudySession close(SessionStatus finalStatus, Instant now, Double accuracy, Double avgConfidence, Double qualityScore) {
        return new StudySession(id, startedAt, now, finalStatus, reviewCount, correctCount, confidenceTotal,
                timeTakenSeconds, accuracy, avgConfidence, qualityScore);
    }
}
