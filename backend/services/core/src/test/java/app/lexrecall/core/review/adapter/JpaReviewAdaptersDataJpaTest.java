package app.lexrecall.core.review.adapter;

import app.lexrecall.core.card.adapter.JpaCardStoreAdapter;
import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.common.error.NotFoundException;
import app.lexrecall.core.review.domain.Confidence;
import app.lexrecall.core.review.domain.ReviewRecord;
import app.lexrecall.core.review.domain.SessionStatus;
import app.lexrecall.core.review.domain.StudySession;
import app.lexrecall.core.support.PostgresIntegrationTest;
import app.lexrecall.core.support.TestCards;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaCardStoreAdapter.class, JpaReviewLogAdapter.class, JpaStudySessionAdapter.class})
class JpaReviewAdaptersDataJpaTest extends PostgresIntegrationTest {

    private static final Instant NOW = Instant.parse("2026-07-01T10:00:00Z");

    @Autowired
    JpaCardStoreAdapter cards;

    @Autowired
    JpaReviewLogAdapter reviewLog;

    @Autowired
    JpaStudySessionAdapter sessions;

    @Test
    void sessionCounters_persistThroughLockAndSave() {
        StudySession created = sessions.create(StudySession.start(UUID.randomUUID(), NOW));

        StudySession locked = sessions.lock(created.id());
        sessions.save(locked.withReview(true, Confidence.HIGH, 30));
        StudySession closed = sessions.save(sessions.get(created.id())
                .close(SessionStatus.COMPLETED, NOW.plusSeconds(60), 1.0, 3.0, 0.875));

        assertThat(closed.reviewCount()).isEqualTo(1);
        assertThat(closed.confidenceTotal()).isEqualTo(3);
        assertThat(closed.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(closed.qualityScore()).isEqualTo(0.875);
    }

    @Test
    void reviewLog_returnsRecordsInWriteOrder() {
        Card card = cards.create(TestCards.newCard(Topic.IOWA_GENERAL, 3));
        StudySession session = sessions.create(StudySession.start(UUID.randomUUID(), NOW));

        ReviewRecord first = reviewLog.append(record(card, session.id(), NOW, 4));
        ReviewRecord second = reviewLog.append(record(card, session.id(), NOW.plusSeconds(30), 2));

        assertThat(reviewLog.findByCard(card.id())).extracting(ReviewRecord::id).containsExactly(first.id(), second.id());
        assertThat(reviewLog.findBySession(session.id())).hasSize(2);
        assertThat(reviewLog.findByCard(card.id()).get(1).confidence()).isEqualTo(Confidence.LOW);
        assertThat(reviewLog.findAll()).extracting(ReviewRecord::id).contains(first.id(), second.id());
    }

    @Test
    void unknownSession_isNotFound() {
        assertThatThrownBy(() -> sessions.get(UUID.randomUUID())).isInstanceOf(NotFoundException.class);
    }

    private static ReviewRecord record(Card card, UUID sessionId, Instant at, int quality) {
        boolean correct = quality >= 3;
        return new ReviewRecord(UUID.randomUUID(), card.id(), sessionId, card.subject(), card.topic(), at,
                quality, correct ? Confidence.MEDIUM : Confidence.LOW, correct, 25,
                correct ? quality : quality - 0.2, correct ? 1 : 0, 1, 2.5);
    }
}
