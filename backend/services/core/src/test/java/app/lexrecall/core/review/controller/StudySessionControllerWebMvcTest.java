package app.lexrecall.core.review.controller;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.SchedulingState;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.common.error.ConcurrencyConflictException;
import app.lexrecall.core.common.error.PersistenceFailureException;
import app.lexrecall.core.review.domain.Confidence;
import app.lexrecall.core.review.domain.ReviewRecord;
import app.lexrecall.core.review.domain.ReviewResult;
import app.lexrecall.core.review.domain.StudySession;
import app.lexrecall.core.review.service.ReviewService;
import app.lexrecall.core.review.service.StudySessionService;
import app.lexrecall.core.support.TestCards;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StudySessionController.class)
@ActiveProfiles("test")
class StudySessionControllerWebMvcTest {

    private static final Instant NOW = Instant.parse("2026-02-10T09:30:00Z");

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    StudySessionService sessionService;

    @MockitoBean
    ReviewService reviewService;

    @Test
    void startSession_returnsActiveSession() throws Exception {
        StudySession s = StudySession.start(UUID.randomUUID(), NOW);
        when(sessionService.startSession()).thenReturn(s);

        mockMvc.perform(post("/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(s.id().toString()))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void getSession_returnsSession() throws Exception {
        StudySession s = StudySession.start(UUID.randomUUID(), NOW);
        when(sessionService.getSession(s.id())).thenReturn(s);

        mockMvc.perform(get("/sessions/{id}", s.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reviewCount").value(0));
    }

    @Test
    void reviewCard_passesParsedConfidenceAndDefaultsCorrectness() throws Exception {
        UUID sessionId = UUID.randomUUID();
        Card card = TestCards.newCard(Topic.CRIMPRO_FIFTH_AMENDMENT_MIRANDA, 3)
                .withState(new SchedulingState(2.5, 1, 1, LocalDate.of(2026, 2, 11), NOW), 1L);
        ReviewRecord record = new ReviewRecord(UUID.randomUUID(), card.id(), sessionId, card.subject(), card.topic(),
                NOW, 4, Confidence.HIGH, true, 12, 4.5, 1, 1, 2.6);
        StudySession session = StudySession.start(sessionId, NOW).withReview(true, Confidence.HIGH, 12);
        when(reviewService.reviewCard(eq(sessionId), eq(card.id()), eq(4), eq(Confidence.HIGH), eq(12), isNull()))
                .thenReturn(new ReviewResult(record, card, session, Map.of(0, 1, 3, 3, 5, 4)));

        mockMvc.perform(post("/sessions/{id}/reviews", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"cardId": "%s", "quality": 4, "confidence": "high", "timeTakenSeconds": 12}
                                """.formatted(card.id())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.adjustedQuality").value(4.5))
                .andExpect(jsonPath("$.intervalDays").value(1))
                .andExpect(jsonPath("$.dueDate").value("2026-02-11"))
                .andExpect(jsonPath("$.sessionReviewCount").value(1))
                .andExpect(jsonPath("$.nextIntervals['0']").value(1))
                .andExpect(jsonPath("$.nextIntervals['5']").value(4));
    }

    @Test
    void reviewCard_rejectsOutOfRangeQualityBeforeService() throws Exception {
        mockMvc.perform(post("/sessions/{id}/reviews", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"cardId": "%s", "quality": 9, "confidence": "LOW"}
                                """.formatted(UUID.randomUUID())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("quality"));

        verifyNoInteractions(reviewService);
    }

    @Test
    void reviewCard_unknownConfidenceIs400() throws Exception {
        mockMvc.perform(post("/sessions/{id}/reviews", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"cardId": "%s", "quality": 3, "confidence": "certain"}
                                """.formatted(UUID.randomUUID())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("confidence"));
    }

    @Test
    void nonUuidSessionId_isMappedTo400Body() throws Exception {
        mockMvc.perform(get("/sessions/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.field").value("sessionId"))
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.timestamp").exists());

        verifyNoInteractions(sessionService);
    }

    @Test
    void malformedReviewBody_isMappedTo400Body() throws Exception {
        mockMvc.perform(post("/sessions/{id}/reviews", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cardId\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MALFORMED_REQUEST"))
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(reviewService);
    }

    @Test
    void reviewCard_conflictIs409() throws Exception {
        UUID cardId = UUID.randomUUID();
        when(reviewService.reviewCard(any(), any(), anyInt(), any(), any(), any()))
                .thenThrow(new ConcurrencyConflictException(cardId, 3L));

        mockMvc.perform(post("/sessions/{id}/reviews", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"cardId": "%s", "quality": 3, "confidence": "MEDIUM"}
                                """.formatted(cardId)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("CONCURRENT_MODIFICATION"));
    }

    @Test
    void endSession_storageFailureIs503() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.endSession(id)).thenThrow(new PersistenceFailureException("Failed to save session", null));

        mockMvc.perform(post("/sessions/{id}/end", id))
                .andExpect(status().isServiceUnavailable());
    }
}
