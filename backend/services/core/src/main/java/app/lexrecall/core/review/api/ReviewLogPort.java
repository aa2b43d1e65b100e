package app.lexrecall.core.review.api;

import app.lexrecall.core.review.domain.ReviewRecord;

import java.util.List;
import java.util.UUID;

/**
 * Append-only review log. Records come back in the order they were written.
 */
public interface ReviewLogPort {

    ReviewRecord append(ReviewRecord record);

    List<ReviewRecord> findByCard(UUID cardId);

    List<ReviewRecord> findBySession(UUID sessionId);

    List<ReviewRecord> findAll();
}
