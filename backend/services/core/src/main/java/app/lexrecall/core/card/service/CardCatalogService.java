package app.lexrecall.core.card.service;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.CardDraft;
import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.review.api.CardStorePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class CardCatalogService {

    private static final Logger log = LoggerFactory.getLogger(CardCatalogService.class);

    static final int MAX_BATCH_SIZE = 1000;

    private final CardStorePort cardStore;
    private final CardDraftValidator validator;
    private final Clock clock;

    public CardCatalogService(CardStorePort cardStore, CardDraftValidator validator, Clock clock) {
        this.cardStore = cardStore;
        this.validator = validator;
        this.clock = clock;
    }

    @Transactional
    public Card createCard(CardDraft draft) {
        Card created = cardStore.create(validator.toNewCard(draft, UUID.randomUUID(), clock.instant()));
        log.info("Card created id={} subject={} topic={}", created.id(), created.subject().code(), created.topic().code());
        return created;
    }

    /**
     * Validates every draft before anything is written, so a bad entry rejects the whole batch.
     */
    @Transactional
    public List<Card> createCards(List<CardDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            throw new ValidationException("cards", "At least one card is required");
        }
        if (drafts.size() > MAX_BATCH_SIZE) {
            throw new ValidationException("cards", "Batch exceeds " + MAX_BATCH_SIZE + " cards");
        }

        Instant now = clock.instant();
        List<Card> validated = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            try {
                validated.add(validator.toNewCard(drafts.get(i), UUID.randomUUID(), now));
            } catch (ValidationException ex) {
                String field = ex.field() == null ? "cards[" + i + "]" : "cards[" + i + "]." + ex.field();
                throw new ValidationException(field, "Card " + i + ": " + ex.getMessage());
            }
        }

        List<Card> created = validated.stream().map(cardStore::create).toList();
        log.info("Card batch imported count={}", created.size());
        return created;
    }

    @Transactional(readOnly = true)
    public Card getCard(UUID cardId) {
        return cardStore.get(cardId);
    }

    @Transactional
    public Card archiveCard(UUID cardId) {
        Card archived = cardStore.archive(cardId);
        log.info("Card archived id={}", cardId);
        return archived;
    }
}
