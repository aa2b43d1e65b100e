package app.lexrecall.core.review.api;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.CardFilter;
import app.lexrecall.core.card.domain.SchedulingState;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Durable card store. Implementations translate storage errors into
 * {@code PersistenceFailureException} and stale writes into {@code ConcurrencyConflictException}.
 */
public interface CardStorePort {

    Card create(Card card);

    /**
     * @throws app.lexrecall.core.common.error.NotFoundException for an unknown id
     */
    Card get(UUID cardId);

    /**
     * Replaces the scheduling state if the stored version still equals {@code expectedVersion}.
     *
     * @return the card with its new version
     */
    Card update(UUID cardId, SchedulingState newState, long expectedVersion);

    Card archive(UUID cardId);

    /**
     * Cards with a due date on or before {@code beforeDate}, ordered by due date then creation time.
     */
    List<Card> queryDue(LocalDate beforeDate, CardFilter filter);

    /**
     * Never-reviewed cards in creation order.
     */
    List<Card> queryNew(CardFilter filter);

    List<Card> findAll(CardFilter filter);
}
