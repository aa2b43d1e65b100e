package app.lexrecall.core.review.controller;

import app.lexrecall.core.review.controller.dto.ReviewCardRequest;
import app.lexrecall.core.review.controller.dto.ReviewCardResponse;
import app.lexrecall.core.review.controller.dto.StudySessionResponse;
import app.lexrecall.core.review.domain.Confidence;
import app.lexrecall.core.review.service.ReviewService;
import app.lexrecall.core.review.service.StudySessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/sessions")
public class StudySessionController {

    private final StudySessionService sessionService;
    private final ReviewService reviewService;

    public StudySessionController(StudySessionService sessionService, ReviewService reviewService) {
        this.sessionService = sessionService;
        this.reviewService = reviewService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public StudySessionResponse start() {
        return StudySessionResponse.from(sessionService.startSession());
    }

    @GetMapping("/{sessionId}")
    public StudySessionResponse get(@PathVariable UUID sessionId) {
        return StudySessionResponse.from(sessionService.getSession(sessionId));
    }

    @PostMapping("/{sessionId}/end")
    public StudySessionResponse end(@PathVariable UUID sessionId) {
        return StudySessionResponse.from(sessionService.endSession(sessionId));
    }

    @PostMapping("/{sessionId}/abandon")
    public StudySessionResponse abandon(@PathVariable UUID sessionId) {
        return StudySessionResponse.from(sessionService.abandonSession(sessionId));
    }

    // POST /sessions/{sessionId}/reviews
    @PostMapping("/{sessionId}/reviews")
    @ResponseStatus(HttpStatus.CREATED)
    public ReviewCardResponse review(@PathVariable UUID sessionId, @Valid @RequestBody ReviewCardRequest request) {
        return ReviewCardResponse.from(reviewService.reviewCard(
                sessionId,
                request.cardId(),
                request.quality(),
                Confidence.fromString(request.confidence()),
                request.timeTakenSeconds(),
                request.correct()
        ));
    }
}
