package app.lexrecall.core.review.adapter;

import app.lexrecall.core.common.error.NotFoundException;
import app.lexrecall.core.common.error.PersistenceFailureException;
import app.lexrecall.core.review.api.StudySessionPort;
import app.lexrecall.core.review.domain.StudySession;
import app.lexrecall.core.review.entity.StudySessionEntity;
import app.lexrecall.core.review.repository.StudySessionRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

@Component
public class JpaStudySessionAdapter implements StudySessionPort {

    private final StudySessionRepository repository;

    public JpaStudySessionAdapter(StudySessionRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public StudySession create(StudySession session) {
        StudySessionEntity e = new StudySessionEntity();
        e.setSessionId(session.id());
        copy(session, e);
        return toDomain(storage(() -> repository.saveAndFlush(e)));
    }

    @Override
    @Transactional(readOnly = true)
    public StudySession get(UUID sessionId) {
        return toDomain(find(() -> repository.findById(sessionId), sessionId));
    }

    @Override
    @Transactional
    public StudySession lock(UUID sessionId) {
        return toDomain(find(() -> repository.findByIdForUpdate(sessionId), sessionId));
    }

    @Override
    @Transactional
    public StudySession save(StudySession session) {
        StudySessionEntity e = find(() -> repository.findById(session.id()), session.id());
        copy(session, e);
        return toDomain(storage(() -> repository.saveAndFlush(e)));
    }

    private static StudySessionEntity find(Supplier<Optional<StudySessionEntity>> query, UUID sessionId) {
        return storage(query).orElseThrow(() -> NotFoundException.session(sessionId));
    }

    private static <T> T storage(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new PersistenceFailureException("Study session storage failed", ex);
        }
    }

    private static void copy(StudySession s, StudySessionEntity e) {
        e.setStartedAt(s.startedAt());
        e.setEndedAt(s.endedAt());
        e.setStatus(s.status());
        e.setReviewCount(s.reviewCount());
        e.setCorrectCount(s.correctCount());
        e.setConfidenceTotal(s.confidenceTotal());
        e.setTimeTakenSeconds(s.timeTakenSeconds());
        e.setAccuracy(s.accuracy());
        e.setAvgConfidence(s.avgConfidence());
        e.setQualityScore(s.qualityScore());
    }

    private static StudySession toDomain(StudySessionEntity e) {
        return new StudySession(
                e.getSessionId(),
                e.getStartedAt(),
                e.getEndedAt(),
                e.getStatus(),
                e.getReviewCount(),
                e.getCorrectCount(),
                e.getConfidenceTotal(),
                e.getTimeTakenSeconds(),
                e.getAccuracy(),
                e.getAvgConfidence(),
                e.getQualityScore()
        );
    }
}
