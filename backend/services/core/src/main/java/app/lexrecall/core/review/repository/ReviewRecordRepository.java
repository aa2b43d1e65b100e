package app.lexrecall.core.review.repository;

import app.lexrecall.core.review.entity.ReviewRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReviewRecordRepository extends JpaRepository<ReviewRecordEntity, UUID> {

    List<ReviewRecordEntity> findByCardIdOrderByReviewedAtAscReviewIdAsc(UUID cardId);

    List<ReviewRecordEntity> findBySessionIdOrderByReviewedAtAscReviewIdAsc(UUID sessionId);

    @Query("select r from ReviewRecordEntity r order by r.reviewedAt asc, r.reviewId asc")
    List<ReviewRecordEntity> findAllOrdered();
}
