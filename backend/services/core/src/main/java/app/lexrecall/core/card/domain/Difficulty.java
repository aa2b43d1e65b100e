package app.lexrecall.core.card.domain;

import app.lexrecall.core.common.error.ValidationException;

public enum Difficulty {
    FUNDAMENTAL(1), BASIC(2), INTERMEDIATE(3), ADVANCED(4), EXPERT(5);

    public static final int MAX_DISTANCE = EXPERT.level - FUNDAMENTAL.level;

    private final int level;

    Difficulty(int level) { this.level = level; }

    public int level() { return level; }

    public static Difficulty ofLevel(int level) {
        for (Difficulty d : values()) {
            if (d.level == level) return d;
        }
        throw new ValidationException("difficulty", "Difficulty must be between 1 and 5, got " + level);
    }
}
