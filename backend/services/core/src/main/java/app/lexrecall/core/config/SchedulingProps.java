package app.lexrecall.core.config;

import app.lexrecall.core.review.algorithm.FailureEasePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "lexrecall.scheduling")
public record SchedulingProps(
        FailureEasePolicy failureEasePolicy,
        int maxConflictRetries,
        String timeZone
) {
    public SchedulingProps {
        if (failureEasePolicy == null) failureEasePolicy = FailureEasePolicy.DEFAULT;
        if (maxConflictRetries <= 0) maxConflictRetries = 3;
        if (timeZone == null || timeZone.isBlank()) timeZone = "UTC";
    }

    public static SchedulingProps defaults() {
        return new SchedulingProps(null, 0, null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }
}
