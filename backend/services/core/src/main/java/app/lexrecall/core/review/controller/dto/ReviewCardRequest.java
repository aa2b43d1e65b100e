package app.lexrecall.core.review.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.UUID;

public record ReviewCardRequest(
        @NotNull UUID cardId,
        @NotNull @Min(0) @Max(5) Integer quality,
        @NotBlank String confidence,
        @PositiveOrZero Integer timeTakenSeconds,
        Boolean correct // defaults to quality >= 3
) {
}
