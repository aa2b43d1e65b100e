package app.lexrecall.core.review.service;

import app.lexrecall.core.common.error.NotFoundException;
import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.review.domain.Confidence;
import app.lexrecall.core.review.domain.SessionStatus;
import app.lexrecall.core.review.domain.StudySession;
import app.lexrecall.core.support.InMemorySessionStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StudySessionServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-10T09:30:00Z");

    private final InMemorySessionStore sessions = new InMemorySessionStore();
    private final StudySessionService service = new StudySessionService(sessions, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void startSession_createsActiveSession() {
        StudySession s = service.startSession();

        assertThat(s.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(s.startedAt()).isEqualTo(NOW);
        assertThat(service.getSession(s.id())).isEqualTo(s);
    }

    @Test
    void endSession_derivesAccuracyConfidenceAndQuality() {
        StudySession s = service.startSession();
        sessions.save(s.withReview(true, Confidence.HIGH, 40).withReview(false, Confidence.LOW, 50));

        StudySession ended = service.endSession(s.id());

        assertThat(ended.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(ended.endedAt()).isEqualTo(NOW);
        assertThat(ended.accuracy()).isEqualTo(0.5);
        assertThat(ended.avgConfidence()).isEqualTo(2.0);
        // 0.5 * 0.5 accuracy + 0.25 * 1.0 pace + 0.25 * 0.5 confidence
        assertThat(ended.qualityScore()).isCloseTo(0.625, within(1e-9));
    }

    @Test
    void slowSession_losesTimeEfficiency() {
        StudySession slow = StudySession.start(UUID.randomUUID(), NOW).withReview(true, Confidence.MEDIUM, 360);

        // pace 90/360 = 0.25
        assertThat(StudySessionService.qualityScore(slow)).isCloseTo(0.5 + 0.25 * 0.25 + 0.25 * 0.5, within(1e-9));
    }

    @Test
    void emptySession_scoresNeutral() {
        StudySession s = service.startSession();

        StudySession ended = service.endSession(s.id());

        assertThat(ended.qualityScore()).isEqualTo(0.5);
        assertThat(ended.accuracy()).isNull();
    }

    @Test
    void abandonSession_keepsCountersAndMarksStatus() {
        StudySession s = service.startSession();
        sessions.save(s.withReview(true, Confidence.MEDIUM, 30));

        StudySession abandoned = service.abandonSession(s.id());

        assertThat(abandoned.status()).isEqualTo(SessionStatus.ABANDONED);
        assertThat(abandoned.reviewCount()).isEqualTo(1);
    }

    @Test
    void closedSession_cannotBeClosedAgain() {
        StudySession s = service.startSession();
        service.endSession(s.id());

        assertThatThrownBy(() -> service.endSession(s.id())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.abandonSession(s.id())).isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownSession_isNotFound() {
        assertThatThrownBy(() -> service.getSession(UUID.randomUUID())).isInstanceOf(NotFoundException.class);
    }
}
