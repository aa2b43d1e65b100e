package app.lexrecall.core.review.adapter;

import app.lexrecall.core.common.error.PersistenceFailureException;
import app.lexrecall.core.review.api.ReviewLogPort;
import app.lexrecall.core.review.domain.ReviewRecord;
import app.lexrecall.core.review.entity.ReviewRecordEntity;
import app.lexrecall.core.review.repository.ReviewRecordRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

@Component
public class JpaReviewLogAdapter implements ReviewLogPort {

    private final ReviewRecordRepository repository;

    public JpaReviewLogAdapter(ReviewRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public ReviewRecord append(ReviewRecord record) {
        try {
            return toDomain(repository.saveAndFlush(toEntity(record)));
        } catch (DataAccessException ex) {
            throw new PersistenceFailureException("Failed to append review record for card " + record.cardId(), ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReviewRecord> findByCard(UUID cardId) {
        return read(() -> repository.findByCardIdOrderByReviewedAtAscReviewIdAsc(cardId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReviewRecord> findBySession(UUID sessionId) {
        return read(() -> repository.findBySessionIdOrderByReviewedAtAscReviewIdAsc(sessionId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReviewRecord> findAll() {
        return read(repository::findAllOrdered);
    }

    private static List<ReviewRecord> read(Supplier<List<ReviewRecordEntity>> query) {
        try {
            return query.get().stream().map(JpaReviewLogAdapter::toDomain).toList();
        } catch (DataAccessException ex) {
            throw new PersistenceFailureException("Failed to read review log", ex);
        }
    }

    private static ReviewRecordEntity toEntity(ReviewRecord r) {
        ReviewRecordEntity e = new ReviewRecordEntity();
        e.setReviewId(r.id());
        e.setCardId(r.cardId());
        e.setSessionId(r.sessionId());
        e.setSubject(r.subject());
        e.setTopic(r.topic());
        e.setReviewedAt(r.reviewedAt());
        e.setRawQuality((short) r.rawQuality());
        e.setConfidence(r.confidence());
        e.setCorrect(r.correct());
        e.setTimeTakenSeconds(r.timeTakenSeconds());
        e.setAdjustedQuality(r.adjustedQuality());
        e.setRepetitionsAfter(r.repetitionsAfter());
        e.setIntervalDaysAfter(r.intervalDaysAfter());
        e.setEaseFactorAfter(r.easeFactorAfter());
        return e;
    }

    private static ReviewRecord toDomain(ReviewRecordEntity e) {
        return new ReviewRecord(
                e.getReviewId(),
                e.getCardId(),
                e.getSessionId(),
                e.getSubject(),
                e.getTopic(),
                e.getReviewedAt(),
                e.getRawQuality(),
                e.getConfidence(),
                e.isCorrect(),
                e.getTimeTakenSeconds(),
                e.getAdjustedQuality(),
                e.getRepetitionsAfter(),
                e.getIntervalDaysAfter(),
                e.getEaseFactorAfter()
        );
    }
}
