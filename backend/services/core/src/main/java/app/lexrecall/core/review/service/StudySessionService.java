package app.lexrecall.core.review.service;

import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.review.api.StudySessionPort;
import app.lexrecall.core.review.domain.Confidence;
import app.lexrecall.core.review.domain.SessionStatus;
import app.lexrecall.core.review.domain.StudySession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

@Service
public class StudySessionService {

    private static final Logger log = LoggerFactory.getLogger(StudySessionService.class);

    /** Seconds per card considered a good pace when scoring time efficiency. */
    static final double TARGET_SECONDS_PER_REVIEW = 90.0;
    static final double EMPTY_SESSION_SCORE = 0.5;

    private final StudySessionPort sessions;
    private final Clock clock;

    public StudySessionService(StudySessionPort sessions, Clock clock) {
        this.sessions = sessions;
        this.clock = clock;
    }

    @Transactional
    public StudySession startSession() {
        StudySession created = sessions.create(StudySession.start(UUID.randomUUID(), clock.instant()));
        log.info("Study session started id={}", created.id());
        return created;
    }

    @Transactional(readOnly = true)
    public StudySession getSession(UUID sessionId) {
        return sessions.get(sessionId);
    }

    @Transactional
    public StudySession endSession(UUID sessionId) {
        StudySession session = requireActive(sessions.lock(sessionId));
        StudySession closed = close(session, SessionStatus.COMPLETED);
        log.info("Study session completed id={} reviews={} accuracy={} quality={}",
                sessionId, closed.reviewCount(), closed.accuracy(), closed.qualityScore());
        return closed;
    }

    /**
     * Closes the session without finishing it. Reviews already recorded stay in the log.
     */
    @Transactional
    public StudySession abandonSession(UUID sessionId) {
        StudySession session = requireActive(sessions.lock(sessionId));
        StudySession closed = close(session, SessionStatus.ABANDONED);
        log.info("Study session abandoned id={} reviews={}", sessionId, closed.reviewCount());
        return closed;
    }

    private StudySession close(StudySession session, SessionStatus status) {
        Double accuracy = session.reviewCount() == 0 ? null : (double) session.correctCount() / session.reviewCount();
        Double avgConfidence = session.reviewCount() == 0 ? null : (double) session.confidenceTotal() / session.reviewCount();
        return sessions.save(session.close(status, clock.instant(), accuracy, avgConfidence, qualityScore(session)));
    }

    /**
     * {@code 0.5*accuracy + 0.25*timeEfficiency + 0.25*confidence}, with confidence rescaled from 1..3 to
     * [0,1]. Sessions without timings count as fully efficient.
     */
    static double qualityScore(StudySession session) {
        int n = session.reviewCount();
        if (n == 0) {
            return EMPTY_SESSION_SCORE;
        }
        double accuracy = (double) session.correctCount() / n;
        double timeEfficiency = session.timeTakenSeconds() <= 0
                ? 1.0
                : Math.min(1.0, TARGET_SECONDS_PER_REVIEW * n / session.timeTakenSeconds());
        double avgConfidence = (double) session.confidenceTotal() / n;
        double confidence = (avgConfidence - Confidence.LOW.score())
                / (Confidence.HIGH.score() - Confidence.LOW.score());
        return 0.5 * accuracy + 0.25 * timeEfficiency + 0.25 * confidence;
    }

    private static StudySession requireActive(StudySession session) {
        if (!session.isActive()) {
            throw new ValidationException("sessionId", "Session " + session.id() + " is already " + session.status());
        }
        return session;
    }
}
