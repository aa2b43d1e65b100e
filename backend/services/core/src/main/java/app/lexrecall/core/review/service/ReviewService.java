package app.lexrecall.core.review.service;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.common.error.ConcurrencyConflictException;
import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.config.SchedulingProps;
import app.lexrecall.core.review.algorithm.ScheduleOutcome;
import app.lexrecall.core.review.algorithm.SchedulingEngine;
import app.lexrecall.core.review.api.CardStorePort;
import app.lexrecall.core.review.api.ReviewLogPort;
import app.lexrecall.core.review.api.StudySessionPort;
import app.lexrecall.core.review.domain.Confidence;
import app.lexrecall.core.review.domain.ReviewRecord;
import app.lexrecall.core.review.domain.ReviewResult;
import app.lexrecall.core.review.domain.StudySession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Records one review: schedules the card, appends the log entry and bumps the session counters in a
 * single transaction. A stale card version rolls everything back and the whole unit is retried from a
 * fresh read.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final CardStorePort cardStore;
    private final ReviewLogPort reviewLog;
    private final StudySessionPort sessions;
    private final SchedulingEngine engine;
    private final PerformanceTracker tracker;
    private final TransactionOperations tx;
    private final Clock clock;
    private final int maxAttempts;

    public ReviewService(CardStorePort cardStore,
                         ReviewLogPort reviewLog,
                         StudySessionPort sessions,
                         SchedulingEngine engine,
                         PerformanceTracker tracker,
                         TransactionOperations tx,
                         Clock clock,
                         SchedulingProps props) {
        this.cardStore = cardStore;
        this.reviewLog = reviewLog;
        this.sessions = sessions;
        this.engine = engine;
        this.tracker = tracker;
        this.tx = tx;
        this.clock = clock;
        this.maxAttempts = props.maxConflictRetries();
    }

    /**
     * @param correct explicit correctness; {@code null} means "quality &gt;= 3"
     */
    public ReviewResult reviewCard(UUID sessionId,
                                   UUID cardId,
                                   int quality,
                                   Confidence confidence,
                                   Integer timeTakenSeconds,
                                   Boolean correct) {
        if (sessionId == null) {
            throw new ValidationException("sessionId", "Session id is required");
        }
        if (cardId == null) {
            throw new ValidationException("cardId", "Card id is required");
        }
        SchedulingEngine.validate(quality, confidence);
        if (timeTakenSeconds != null && timeTakenSeconds < 0) {
            throw new ValidationException("timeTakenSeconds", "Time taken must not be negative");
        }
        boolean isCorrect = correct != null ? correct : quality >= SchedulingEngine.PASSING_QUALITY;

        for (int attempt = 1; ; attempt++) {
            try {
                ReviewResult result = tx.execute(status ->
                        recordOnce(sessionId, cardId, quality, confidence, timeTakenSeconds, isCorrect));
                tracker.onReviewRecorded(result.record());
                log.info("Review recorded card={} session={} quality={} confidence={} correct={} interval={} reps={}",
                        cardId, sessionId, quality, confidence, isCorrect,
                        result.card().state().intervalDays(), result.card().state().repetitions());
                return result;
            } catch (ConcurrencyConflictException | OptimisticLockingFailureException ex) {
                if (attempt >= maxAttempts) {
                    log.warn("Review gave up after conflicts card={} session={} attempts={}", cardId, sessionId, attempt);
                    throw ex instanceof ConcurrencyConflictException cce
                            ? cce
                            : new ConcurrencyConflictException(cardId, ex);
                }
                log.debug("Review conflict, retrying card={} attempt={}", cardId, attempt);
            }
        }
    }

    private ReviewResult recordOnce(UUID sessionId,
                                    UUID cardId,
                                    int quality,
                                    Confidence confidence,
                                    Integer timeTakenSeconds,
                                    boolean correct) {
        StudySession session = sessions.lock(sessionId);
        if (!session.isActive()) {
            throw new ValidationException("sessionId", "Session " + sessionId + " is " + session.status());
        }
        Card card = cardStore.get(cardId);
        if (card.archived()) {
            throw new ValidationException("cardId", "Card " + cardId + " is archived");
        }

        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        ScheduleOutcome outcome = engine.apply(card.state(), quality, confidence, correct, now, today);

        Card updated = cardStore.update(cardId, outcome.state(), card.version());
        ReviewRecord record = reviewLog.append(new ReviewRecord(
                UUID.randomUUID(),
                cardId,
                sessionId,
                card.subject(),
                card.topic(),
                now,
                quality,
                confidence,
                correct,
                timeTakenSeconds,
                outcome.adjustedQuality(),
                outcome.state().repetitions(),
                outcome.state().intervalDays(),
                outcome.state().easeFactor()
        ));
        StudySession savedSession = sessions.save(session.withReview(correct, confidence, timeTakenSeconds));
        return new ReviewResult(record, updated, savedSession, engine.previewIntervals(updated.state(), today));
    }
}
