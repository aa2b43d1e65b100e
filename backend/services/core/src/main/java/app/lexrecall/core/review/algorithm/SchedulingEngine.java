package app.lexrecall.core.review.algorithm;

import app.lexrecall.core.card.domain.SchedulingState;
import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.config.SchedulingProps;
import app.lexrecall.core.review.domain.Confidence;
import app.lexrecall.core.review.domain.ReviewRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SM-2 state transition with a confidence-weighted quality. Stateless: every call takes the current
 * state and returns a new one, so the same ordered history always yields the same result.
 */
@Component
public class SchedulingEngine {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 5;
    public static final int PASSING_QUALITY = 3;
    public static final int MAX_INTERVAL_DAYS = 36500;

    private final FailureEasePolicy failureEasePolicy;

    public SchedulingEngine(SchedulingProps props) {
        this.failureEasePolicy = props.failureEasePolicy();
    }

    public FailureEasePolicy failureEasePolicy() {
        return failureEasePolicy;
    }

    public ScheduleOutcome apply(SchedulingState state,
                                 int rawQuality,
                                 Confidence confidence,
                                 boolean correct,
                                 Instant reviewedAt,
                                 LocalDate today) {
        validate(rawQuality, confidence);
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(today, "today");

        double q = adjustedQuality(rawQuality, confidence, correct);

        double ef = state.easeFactor();
        int reps;
        int interval;
        boolean success = q >= PASSING_QUALITY;

        if (!success) {
            reps = 0;
            interval = 1;
            if (failureEasePolicy == FailureEasePolicy.DECREASE) {
                ef = nextEaseFactor(ef, q);
            }
        } else {
            reps = state.repetitions() + 1;
            ef = nextEaseFactor(ef, q);
            if (reps == 1) {
                interval = 1;
            } else if (reps == 2) {
                interval = 6;
            } else {
                long next = Math.round(state.intervalDays() * ef);
                interval = (int) Math.max(1, Math.min(MAX_INTERVAL_DAYS, next));
            }
        }

        SchedulingState next = new SchedulingState(ef, interval, reps, today.plusDays(interval), reviewedAt);
        return new ScheduleOutcome(next, q, success);
    }

    /**
     * Re-applies an ordered review history to {@code initial}. Each record is evaluated on the calendar
     * day of its own timestamp in {@code zone}.
     */
    public SchedulingState replay(SchedulingState initial, List<ReviewRecord> history, ZoneId zone) {
        SchedulingState st = initial;
        for (ReviewRecord r : history) {
            LocalDate day = LocalDate.ofInstant(r.reviewedAt(), zone);
            st = apply(st, r.rawQuality(), r.confidence(), r.correct(), r.reviewedAt(), day).state();
        }
        return st;
    }

    /**
     * Interval in days each raw quality would produce from {@code state} at neutral confidence.
     */
    public Map<Integer, Integer> previewIntervals(SchedulingState state, LocalDate today) {
        Map<Integer, Integer> out = new LinkedHashMap<>();
        for (int q = MIN_QUALITY; q <= MAX_QUALITY; q++) {
            out.put(q, apply(state, q, Confidence.MEDIUM, q >= PASSING_QUALITY, null, today).state().intervalDays());
        }
        return out;
    }

    public static double confidenceAdjustment(Confidence confidence, boolean correct) {
        return switch (confidence) {
            case HIGH -> correct ? 0.5 : -1.0;
            case LOW -> correct ? 0.3 : -0.2;
            case MEDIUM -> 0.0;
        };
    }

    public static double adjustedQuality(int rawQuality, Confidence confidence, boolean correct) {
        return clamp(rawQuality + confidenceAdjustment(confidence, correct), MIN_QUALITY, MAX_QUALITY);
    }

    public static double nextEaseFactor(double ef, double q) {
        double next = ef + (0.1 - (5 - q) * (0.08 + (5 - q) * 0.02));
        return Math.max(SchedulingState.MIN_EASE_FACTOR, next);
    }

    public static void validate(int rawQuality, Confidence confidence) {
        if (rawQuality < MIN_QUALITY || rawQuality > MAX_QUALITY) {
            throw new ValidationException("quality", "Quality must be between 0 and 5, got " + rawQuality);
        }
        if (confidence == null) {
            throw new ValidationException("confidence", "Confidence is required");
        }
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
