package app.lexrecall.core.card.controller.dto;

import app.lexrecall.core.card.domain.Card;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record CardResponse(
        UUID id,
        String subject,
        String topic,
        String conceptName,
        String question,
        String answer,
        int difficulty,
        List<String> tags,
        Instant createdAt,
        boolean archived,
        double easeFactor,
        int intervalDays,
        int repetitions,
        LocalDate dueDate,
        Instant lastReviewedAt,
        long version
) {
    public static CardResponse from(Card card) {
        return new CardResponse(
                card.id(),
                card.subject().code(),
                card.topic().code(),
                card.conceptName(),
                card.question(),
                card.answer(),
                card.difficulty().level(),
                card.tags().stream().sorted().toList(),
                card.createdAt(),
                card.archived(),
                card.state().easeFactor(),
                card.state().intervalDays(),
                card.state().repetitions(),
                card.state().dueDate(),
                card.state().lastReviewedAt(),
                card.version()
        );
    }
}
