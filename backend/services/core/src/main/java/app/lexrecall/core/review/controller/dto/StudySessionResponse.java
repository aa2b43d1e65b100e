package app.lexrecall.core.review.controller.dto;

import app.lexrecall.core.review.domain.SessionStatus;
import app.lexrecall.core.review.domain.StudySession;

import java.time.Instant;
import java.util.UUID;

public record StudySessionResponse(
        UUID id,
        Instant startedAt,
        Instant endedAt,
        SessionStatus status,
        int reviewCount,
        int correctCount,
        long timeTakenSeconds,
        Double accuracy,
        Double avgConfidence,
        Double qualityScore
) {
    public static StudySessionResponse from(StudySession s) {
        return new StudySessionResponse(
                s.id(),
                s.startedAt(),
                s.endedAt(),
                s.status(),
                s.reviewCount(),
                s.correctCount(),
                s.timeTakenSeconds(),
                s.accuracy(),
                s.avgConfidence(),
                s.qualityScore()
        );
    }
}
