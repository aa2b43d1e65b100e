package app.lexrecall.core.card.service;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.CardDraft;
import app.lexrecall.core.card.domain.Difficulty;
import app.lexrecall.core.card.domain.SchedulingState;
import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.common.error.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Maps an untrusted {@link CardDraft} onto the closed subject/topic/difficulty enumerations. The first
 * offending field is reported; nothing is created for a rejected draft.
 */
@Component
public class CardDraftValidator {

    static final int MAX_TEXT_LENGTH = 10_000;
    static final int MAX_TAG_LENGTH = 64;

    public Card toNewCard(CardDraft draft, UUID id, Instant createdAt) {
        if (draft == null) {
            throw new ValidationException(null, "Card payload is required");
        }
        Subject subject = Subject.fromCode(draft.subject());
        Topic topic = Topic.fromCode(subject, draft.topic());
        String conceptName = requireText("conceptName", draft.conceptName());
        String question = requireText("question", draft.question());
        String answer = requireText("answer", draft.answer());
        if (draft.difficulty() == null) {
            throw new ValidationException("difficulty", "Difficulty is required");
        }
        Difficulty difficulty = Difficulty.ofLevel(draft.difficulty());

        return new Card(
                id,
                subject,
                topic,
                conceptName,
                question,
                answer,
                difficulty,
                normalizeTags(draft.tags()),
                createdAt,
                false,
                SchedulingState.initial(),
                0L
        );
    }

    private static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException(field, field + " exceeds " + MAX_TEXT_LENGTH + " characters");
        }
        return trimmed;
    }

    private static Set<String> normalizeTags(Set<String> tags) {
        Set<String> out = new LinkedHashSet<>();
        if (tags == null) return out;
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) continue;
            String t = tag.trim();
            if (t.length() > MAX_TAG_LENGTH) {
                throw new ValidationException("tags", "Tag exceeds " + MAX_TAG_LENGTH + " characters: " + t);
            }
            out.add(t);
        }
        return out;
    }
}
