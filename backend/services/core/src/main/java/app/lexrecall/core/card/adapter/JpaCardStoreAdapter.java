package app.lexrecall.core.card.adapter;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.CardFilter;
import app.lexrecall.core.card.domain.SchedulingState;
import app.lexrecall.core.card.entity.CardEntity;
import app.lexrecall.core.card.repository.CardRepository;
import app.lexrecall.core.common.error.ConcurrencyConflictException;
import app.lexrecall.core.common.error.NotFoundException;
import app.lexrecall.core.common.error.PersistenceFailureException;
import app.lexrecall.core.review.api.CardStorePort;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

@Component
public class JpaCardStoreAdapter implements CardStorePort {

    private final CardRepository cardRepository;

    public JpaCardStoreAdapter(CardRepository cardRepository) {
        this.cardRepository = cardRepository;
    }

    @Override
    @Transactional
    public Card create(Card card) {
        return storage("create card " + card.id(),
                () -> CardMapper.toDomain(cardRepository.saveAndFlush(CardMapper.toNewEntity(card))));
    }

    @Override
    @Transactional(readOnly = true)
    public Card get(UUID cardId) {
        return CardMapper.toDomain(load(cardId));
    }

    @Override
    @Transactional
    public Card update(UUID cardId, SchedulingState newState, long expectedVersion) {
        CardEntity entity = load(cardId);
        if (entity.getRowVersion() != expectedVersion) {
            throw new ConcurrencyConflictException(cardId, expectedVersion);
        }
        CardMapper.applyState(entity, newState);
        try {
            return storage("update card " + cardId, () -> CardMapper.toDomain(cardRepository.saveAndFlush(entity)));
        } catch (PersistenceFailureException ex) {
            if (ex.getCause() instanceof OptimisticLockingFailureException) {
                throw new ConcurrencyConflictException(cardId, ex.getCause());
            }
            throw ex;
        }
    }

    @Override
    @Transactional
    public Card archive(UUID cardId) {
        CardEntity entity = load(cardId);
        entity.setArchived(true);
        return storage("archive card " + cardId, () -> CardMapper.toDomain(cardRepository.saveAndFlush(entity)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Card> queryDue(LocalDate beforeDate, CardFilter filter) {
        return storage("query due cards", () -> cardRepository
                .findDue(beforeDate, filter.subject(), filter.topic(), filter.includeArchived())
                .stream()
                .map(CardMapper::toDomain)
                .toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Card> queryNew(CardFilter filter) {
        return storage("query new cards", () -> cardRepository
                .findNew(filter.subject(), filter.topic(), filter.includeArchived())
                .stream()
                .map(CardMapper::toDomain)
                .toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Card> findAll(CardFilter filter) {
        return storage("list cards", () -> cardRepository
                .findFiltered(filter.subject(), filter.topic(), filter.includeArchived())
                .stream()
                .map(CardMapper::toDomain)
                .toList());
    }

    private CardEntity load(UUID cardId) {
        return storage("load card " + cardId, () -> cardRepository.findById(cardId))
                .orElseThrow(() -> NotFoundException.card(cardId));
    }

    private static <T> T storage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new PersistenceFailureException("Failed to " + operation, ex);
        }
    }
}
