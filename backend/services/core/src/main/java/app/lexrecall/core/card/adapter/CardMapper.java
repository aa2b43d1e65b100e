package app.lexrecall.core.card.adapter;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.Difficulty;
import app.lexrecall.core.card.domain.SchedulingState;
import app.lexrecall.core.card.entity.CardEntity;

import java.util.ArrayList;
import java.util.LinkedHashSet;

final class CardMapper {

    private CardMapper() {
    }

    static Card toDomain(CardEntity e) {
        SchedulingState state = new SchedulingState(
                e.getEaseFactor(),
                e.getIntervalDays(),
                e.getRepetitions(),
                e.getDueDate(),
                e.getLastReviewedAt()
        );
        return new Card(
                e.getCardId(),
                e.getSubject(),
                e.getTopic(),
                e.getConceptName(),
                e.getQuestion(),
                e.getAnswer(),
                Difficulty.ofLevel(e.getDifficulty()),
                e.getTags() == null ? null : new LinkedHashSet<>(e.getTags()),
                e.getCreatedAt(),
                e.isArchived(),
                state,
                e.getRowVersion()
        );
    }

    static CardEntity toNewEntity(Card card) {
        CardEntity e = new CardEntity();
        e.setCardId(card.id());
        e.setSubject(card.subject());
        e.setTopic(card.topic());
        e.setConceptName(card.conceptName());
        e.setQuestion(card.question());
        e.setAnswer(card.answer());
        e.setDifficulty((short) card.difficulty().level());
        e.setTags(new ArrayList<>(card.tags()));
        e.setCreatedAt(card.createdAt());
        e.setArchived(card.archived());
        applyState(e, card.state());
        return e;
    }

    static void applyState(CardEntity e, SchedulingState state) {
        e.setEaseFactor(state.easeFactor());
        e.setIntervalDays(state.intervalDays());
        e.setRepetitions(state.repetitions());
        e.setDueDate(state.dueDate());
        e.setLastReviewedAt(state.lastReviewedAt());
    }
}
