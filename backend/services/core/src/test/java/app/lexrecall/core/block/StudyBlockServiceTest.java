package app.lexrecall.core.block;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.config.BlockProps;
import app.lexrecall.core.config.PerformanceProps;
import app.lexrecall.core.config.PriorityProps;
import app.lexrecall.core.review.service.PerformanceTracker;
import app.lexrecall.core.support.InMemoryCardStore;
import app.lexrecall.core.support.TestCards;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StudyBlockServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-04T07:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 5, 4);

    InMemoryCardStore cards;
    StudyBlockService service;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        BlockProps props = BlockProps.defaults();
        cards = new InMemoryCardStore();
        service = new StudyBlockService(
                cards,
                new PerformanceTracker(clock, PerformanceProps.defaults()),
                new BlockGenerator(new PriorityScorer(PriorityProps.defaults(), clock), props),
                props,
                clock
        );
    }

    @Test
    void block_usesConfiguredDefaultSize() {
        for (int i = 0; i < 30; i++) {
            Topic topic = Topic.forSubject(Subject.REAL_PROPERTY).get(i % 6);
            cards.create(TestCards.reviewedCard(topic, 3, TODAY.minusDays(i % 3), 6, 2));
        }

        List<Card> block = service.getStudyBlock(null, null, true, true, null);

        assertThat(block).hasSize(BlockProps.defaults().defaultSize());
    }

    @Test
    void block_readsOnlyRequestedPartitionsAndSubject() {
        Card dueTort = cards.create(TestCards.reviewedCard(Topic.TORTS_NEGLIGENCE, 3, TODAY, 6, 2));
        Card newTort = cards.create(TestCards.newCard(Topic.TORTS_NEGLIGENCE, 3));
        cards.create(TestCards.reviewedCard(Topic.CONTRACTS_FORMATION, 3, TODAY, 6, 2));
        cards.create(TestCards.reviewedCard(Topic.TORTS_NUISANCE, 3, TODAY.plusDays(4), 6, 2));

        assertThat(service.getStudyBlock(10, Subject.TORTS, true, true, null)).containsExactly(dueTort, newTort);
        assertThat(service.getStudyBlock(10, Subject.TORTS, false, true, null)).containsExactly(dueTort);
        assertThat(service.getStudyBlock(10, Subject.TORTS, true, false, null)).containsExactly(newTort);
    }

    @Test
    void archivedCards_neverAppear() {
        Card card = cards.create(TestCards.newCard(Topic.FAMILY_DIVORCE, 2));
        cards.archive(card.id());

        assertThat(service.getStudyBlock(5, null, true, true, null)).isEmpty();
    }
}
