package app.lexrecall.core.card.controller;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.CardDraft;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.card.service.CardCatalogService;
import app.lexrecall.core.common.error.NotFoundException;
import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.support.TestCards;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CardController.class)
@ActiveProfiles("test")
class CardControllerWebMvcTest {

    private static final String CARD_JSON = """
            {
              "subject": "torts",
              "topic": "negligence",
              "conceptName": "Duty",
              "question": "When is a duty owed?",
              "answer": "To foreseeable plaintiffs.",
              "difficulty": 2,
              "tags": ["mbe"]
            }
            """;

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    CardCatalogService catalogService;

    @Test
    void createCard_returnsCreatedCard() throws Exception {
        Card card = TestCards.newCard(Topic.TORTS_NEGLIGENCE, 2);
        when(catalogService.createCard(any(CardDraft.class))).thenReturn(card);

        mockMvc.perform(post("/cards")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(card.id().toString()))
                .andExpect(jsonPath("$.subject").value("torts"))
                .andExpect(jsonPath("$.topic").value("negligence"))
                .andExpect(jsonPath("$.difficulty").value(2))
                .andExpect(jsonPath("$.repetitions").value(0));
    }

    @Test
    void createCard_mapsValidationErrorTo400() throws Exception {
        when(catalogService.createCard(any(CardDraft.class)))
                .thenThrow(new ValidationException("topic", "Unknown topic 'x' for subject torts"));

        mockMvc.perform(post("/cards")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.field").value("topic"))
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void createBatch_rejectsEmptyList() throws Exception {
        mockMvc.perform(post("/cards/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cards\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("cards"));
    }

    @Test
    void createBatch_returnsAllCards() throws Exception {
        when(catalogService.createCards(anyList())).thenReturn(List.of(
                TestCards.newCard(Topic.TORTS_NEGLIGENCE, 2),
                TestCards.newCard(Topic.TORTS_NEGLIGENCE, 3)));

        mockMvc.perform(post("/cards/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cards\": [" + CARD_JSON + "," + CARD_JSON + "]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void getCard_unknownIdIs404() throws Exception {
        UUID id = UUID.randomUUID();
        when(catalogService.getCard(id)).thenThrow(NotFoundException.card(id));

        mockMvc.perform(get("/cards/{cardId}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void archiveCard_returnsArchivedCard() throws Exception {
        Card archived = TestCards.newCard(Topic.TORTS_NEGLIGENCE, 2).archive();
        when(catalogService.archiveCard(archived.id())).thenReturn(archived);

        mockMvc.perform(post("/cards/{cardId}/archive", archived.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.archived").value(true));
    }
}
