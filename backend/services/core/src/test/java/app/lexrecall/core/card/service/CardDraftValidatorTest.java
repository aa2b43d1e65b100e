package app.lexrecall.core.card.service;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.CardDraft;
import app.lexrecall.core.card.domain.Difficulty;
import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.common.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardDraftValidatorTest {

    private static final Instant NOW = Instant.parse("2026-01-05T12:00:00Z");

    private final CardDraftValidator validator = new CardDraftValidator();

    @Test
    void validDraft_mapsOntoEnumsAndFreshState() {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(" mbe ");
        tags.add("");
        tags.add("iowa");
        CardDraft draft = new CardDraft("torts", "NEGLIGENCE", " Duty ", "What is duty?", "An obligation.", 2, tags);

        Card card = validator.toNewCard(draft, UUID.randomUUID(), NOW);

        assertThat(card.subject()).isEqualTo(Subject.TORTS);
        assertThat(card.topic()).isEqualTo(Topic.TORTS_NEGLIGENCE);
        assertThat(card.conceptName()).isEqualTo("Duty");
        assertThat(card.difficulty()).isEqualTo(Difficulty.BASIC);
        assertThat(card.tags()).containsExactlyInAnyOrder("mbe", "iowa");
        assertThat(card.state().isNew()).isTrue();
        assertThat(card.archived()).isFalse();
        assertThat(card.createdAt()).isEqualTo(NOW);
    }

    @Test
    void unknownSubject_isRejected() {
        assertField(draft("admiralty", "general", 3), "subject");
    }

    @Test
    void topicFromAnotherSubject_isRejected() {
        assertField(draft("torts", "formation", 3), "topic");
    }

    @Test
    void blankText_isRejected() {
        assertField(new CardDraft("torts", "negligence", "x", "  ", "a", 3, null), "question");
        assertField(new CardDraft("torts", "negligence", null, "q", "a", 3, null), "conceptName");
        assertField(new CardDraft("torts", "negligence", "x", "q", "", 3, null), "answer");
    }

    @Test
    void difficultyOutOfRange_isRejected() {
        assertField(draft("torts", "negligence", 0), "difficulty");
        assertField(draft("torts", "negligence", 6), "difficulty");
        assertField(draft("torts", "negligence", null), "difficulty");
    }

    private static CardDraft draft(String subject, String topic, Integer difficulty) {
        return new CardDraft(subject, topic, "concept", "question", "answer", difficulty, Set.of());
    }

    private void assertField(CardDraft draft, String field) {
        assertThatThrownBy(() -> validator.toNewCard(draft, UUID.randomUUID(), NOW))
                .isInstanceOf(ValidationException.class)
                .extracting(ex -> ((ValidationException) ex).field())
                .isEqualTo(field);
    }
}
