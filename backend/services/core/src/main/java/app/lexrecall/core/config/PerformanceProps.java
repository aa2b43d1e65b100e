package app.lexrecall.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lexrecall.performance")
public record PerformanceProps(
        int masteryRepetitions,
        Double masteryAccuracy,
        int windowDays
) {
    public PerformanceProps {
        if (masteryRepetitions <= 0) masteryRepetitions = 5;
        if (masteryAccuracy == null) masteryAccuracy = 0.8;
        if (windowDays <= 0) windowDays = 7;
    }

    public static PerformanceProps defaults() {
        return new PerformanceProps(0, null, 0);
    }
}
