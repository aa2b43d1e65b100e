package app.lexrecall.core.block.controller.dto;

import app.lexrecall.core.card.controller.dto.CardResponse;

import java.util.List;

public record StudyBlockResponse(
        int size,
        List<CardResponse> cards
) {
}
