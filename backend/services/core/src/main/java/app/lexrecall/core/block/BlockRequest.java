package app.lexrecall.core.block;

import app.lexrecall.core.card.domain.Subject;

public record BlockRequest(
        int blockSize,
        Subject subjectFilter,
        boolean includeNew,
        boolean includeReview,
        Integer difficultyTarget
) {
}
