package app.lexrecall.core.review.domain;

import app.lexrecall.core.common.error.ValidationException;

import java.util.Locale;

public enum Confidence {
    LOW(1), MEDIUM(2), HIGH(3);

    private final int score;

    Confidence(int score) { this.score = score; }

    public int score() { return score; }

    public static Confidence fromString(String v) {
        if (v == null || v.isBlank()) {
            throw new ValidationException("confidence", "Confidence is required");
        }
        try {
            return Confidence.valueOf(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("confidence", "Unrecognized confidence level: " + v);
        }
    }
}
