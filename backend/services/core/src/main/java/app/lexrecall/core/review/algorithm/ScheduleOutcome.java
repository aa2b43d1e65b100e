package app.lexrecall.core.review.algorithm;

import app.lexrecall.core.card.domain.SchedulingState;

public record ScheduleOutcome(
        SchedulingState state,
        double adjustedQuality,
        boolean successful
) {
}
