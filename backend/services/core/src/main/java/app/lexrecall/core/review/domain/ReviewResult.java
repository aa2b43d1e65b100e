package app.lexrecall.core.review.domain;

import app.lexrecall.core.card.domain.Card;

import java.util.Map;

/**
 * Outcome of one review. {@code nextIntervals} maps each raw quality to the interval in days the
 * card's new state would get on its next review.
 */
public record ReviewResult(
        ReviewRecord record,
        Card card,
        StudySession session,
        Map<Integer, Integer> nextIntervals
) {
}
