package app.lexrecall.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Weights and shaping constants for the priority score. Defaults: dueness 0.4, difficulty alignment
 * 0.2, mastery gap 0.25, recency gap 0.15.
 */
@ConfigurationProperties(prefix = "lexrecall.priority")
public record PriorityProps(
        Double duenessWeight,
        Double difficultyWeight,
        Double masteryWeight,
        Double recencyWeight,
        int overdueCapDays,
        int recencyHorizonDays
) {
    public PriorityProps {
        if (duenessWeight == null) duenessWeight = 0.4;
        if (difficultyWeight == null) difficultyWeight = 0.2;
        if (masteryWeight == null) masteryWeight = 0.25;
        if (recencyWeight == null) recencyWeight = 0.15;
        if (duenessWeight < 0 || difficultyWeight < 0 || masteryWeight < 0 || recencyWeight < 0) {
            throw new IllegalArgumentException("lexrecall.priority weights must not be negative");
        }
        if (duenessWeight + difficultyWeight + masteryWeight + recencyWeight == 0) {
            throw new IllegalArgumentException("lexrecall.priority weights must not all be zero");
        }
        if (overdueCapDays < 0 || recencyHorizonDays < 0) {
            throw new IllegalArgumentException("lexrecall.priority day limits must not be negative");
        }
        if (overdueCapDays == 0) overdueCapDays = 14;
        if (recencyHorizonDays == 0) recencyHorizonDays = 7;
    }

    public static PriorityProps defaults() {
        return new PriorityProps(null, null, null, null, 0, 0);
    }
}
