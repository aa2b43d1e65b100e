package app.lexrecall.core.card.domain;

import app.lexrecall.core.common.error.ValidationException;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Spaced-repetition state of a single card. A {@code null} due date means the card has never been
 * scheduled and is due immediately.
 */
public record SchedulingState(
        double easeFactor,
        int intervalDays,
        int repetitions,
        LocalDate dueDate,
        Instant lastReviewedAt
) {
    public static final double DEFAULT_EASE_FACTOR = 2.5;
    public static final double MIN_EASE_FACTOR = 1.3;

    public SchedulingState {
        if (Double.isNaN(easeFactor) || easeFactor < MIN_EASE_FACTOR) {
            throw new ValidationException("easeFactor", "Ease factor must be >= " + MIN_EASE_FACTOR + ", got " + easeFactor);
        }
        if (intervalDays < 1) {
            throw new ValidationException("intervalDays", "Interval must be >= 1 day, got " + intervalDays);
        }
        if (repetitions < 0) {
            throw new ValidationException("repetitions", "Repetitions must be >= 0, got " + repetitions);
        }
    }

    public static SchedulingState initial() {
        return new SchedulingState(DEFAULT_EASE_FACTOR, 1, 0, null, null);
    }

    public boolean isNew() {
        return dueDate == null && lastReviewedAt == null;
    }

    public boolean isDueOn(LocalDate day) {
        return dueDate != null && !dueDate.isAfter(day);
    }
}
