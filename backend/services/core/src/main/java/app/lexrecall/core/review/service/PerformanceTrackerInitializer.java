package app.lexrecall.core.review.service;

import app.lexrecall.core.review.api.ReviewLogPort;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads the performance view from the review log once the application is up.
 */
@Component
public class PerformanceTrackerInitializer {

    private final ReviewLogPort reviewLog;
    private final PerformanceTracker tracker;

    public PerformanceTrackerInitializer(ReviewLogPort reviewLog, PerformanceTracker tracker) {
        this.reviewLog = reviewLog;
        this.tracker = tracker;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void rebuildOnStartup() {
        tracker.rebuild(reviewLog::findAll);
    }
}
