package app.lexrecall.core.card.controller.dto;

import app.lexrecall.core.card.domain.CardDraft;

import java.util.Set;

// field checks live in CardDraftValidator so batch imports report the same errors
public record CreateCardRequest(
        String subject,
        String topic,
        String conceptName,
        String question,
        String answer,
        Integer difficulty,
        Set<String> tags
) {
    public CardDraft toDraft() {
        return new CardDraft(subject, topic, conceptName, question, answer, difficulty, tags);
    }
}
