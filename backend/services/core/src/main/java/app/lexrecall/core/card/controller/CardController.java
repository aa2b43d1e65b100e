package app.lexrecall.core.card.controller;

import app.lexrecall.core.card.controller.dto.BatchCreateCardsRequest;
import app.lexrecall.core.card.controller.dto.CardResponse;
import app.lexrecall.core.card.controller.dto.CreateCardRequest;
import app.lexrecall.core.card.service.CardCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/cards")
public class CardController {

    private final CardCatalogService catalogService;

    public CardController(CardCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    // POST /cards
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CardResponse create(@RequestBody CreateCardRequest request) {
        return CardResponse.from(catalogService.createCard(request.toDraft()));
    }

    // POST /cards/batch
    @PostMapping("/batch")
    @ResponseStatus(HttpStatus.CREATED)
    public List<CardResponse> createBatch(@Valid @RequestBody BatchCreateCardsRequest request) {
        var drafts = request.cards().stream().map(r -> r == null ? null : r.toDraft()).toList();
        return catalogService.createCards(drafts).stream().map(CardResponse::from).toList();
    }

    // GET /cards/{cardId}
    @GetMapping("/{cardId}")
    public CardResponse get(@PathVariable UUID cardId) {
        return CardResponse.from(catalogService.getCard(cardId));
    }

    // POST /cards/{cardId}/archive
    @PostMapping("/{cardId}/archive")
    public CardResponse archive(@PathVariable UUID cardId) {
        return CardResponse.from(catalogService.archiveCard(cardId));
    }
}
