package app.lexrecall.core.card.controller.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchCreateCardsRequest(
        @NotEmpty List<CreateCardRequest> cards
) {
}
