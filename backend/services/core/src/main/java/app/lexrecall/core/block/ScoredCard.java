package app.lexrecall.core.block;

import app.lexrecall.core.card.domain.Card;

/**
 * @param position index of the card in the (deduplicated) pool, used as the final tie-break
 */
public record ScoredCard(Card card, double score, int position) {
}
