package app.lexrecall.core.review.service;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.CardFilter;
import app.lexrecall.core.card.domain.SchedulingState;
import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.review.api.CardStorePort;
import app.lexrecall.core.review.domain.ForecastDay;
import app.lexrecall.core.review.domain.StudyStatistics;
import app.lexrecall.core.review.domain.SubjectStatistics;
import app.lexrecall.core.review.domain.TopicStats;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class StudyStatisticsService {

    public static final int DEFAULT_FORECAST_DAYS = 7;
    public static final int MAX_FORECAST_DAYS = 90;
    public static final double DEFAULT_WEAK_THRESHOLD = 0.7;

    static final String BUCKET_NEW = "new";
    static final String BUCKET_1D = "1d";
    static final String BUCKET_2_7D = "2-7d";
    static final String BUCKET_8_21D = "8-21d";
    static final String BUCKET_22_60D = "22-60d";
    static final String BUCKET_60D_PLUS = "60d+";

    private final CardStorePort cardStore;
    private final PerformanceTracker tracker;
    private final Clock clock;

    public StudyStatisticsService(CardStorePort cardStore, PerformanceTracker tracker, Clock clock) {
        this.cardStore = cardStore;
        this.tracker = tracker;
        this.clock = clock;
    }

    public StudyStatistics getStatistics() {
        LocalDate today = LocalDate.now(clock);
        List<Card> cards = cardStore.findAll(CardFilter.ACTIVE);

        Map<Subject, long[]> perSubject = new EnumMap<>(Subject.class);
        Map<String, Long> intervals = emptyDistribution();
        long due = 0;
        long fresh = 0;
        long mastered = 0;
        double easeSum = 0;

        for (Card card : cards) {
            SchedulingState st = card.state();
            long[] s = perSubject.computeIfAbsent(card.subject(), k -> new long[4]);
            s[0]++;
            easeSum += st.easeFactor();
            intervals.merge(bucketOf(st), 1L, Long::sum);
            if (st.isNew()) {
                fresh++;
                s[2]++;
            } else if (st.isDueOn(today)) {
                due++;
                s[1]++;
            }
            if (tracker.isCardMastered(card)) {
                mastered++;
                s[3]++;
            }
        }

        List<SubjectStatistics> subjects = new ArrayList<>();
        perSubject.forEach((subject, s) -> subjects.add(
                new SubjectStatistics(subject, s[0], s[1], s[2], s[3], tracker.get7DayAccuracy(subject))));

        long total = tracker.totalReviews();
        long correct = tracker.correctReviews();
        return new StudyStatistics(
                today,
                cards.size(),
                due,
                fresh,
                mastered,
                total,
                correct,
                total == 0 ? 0.0 : (double) correct / total,
                tracker.get7DayAccuracy(null),
                cards.isEmpty() ? 0.0 : easeSum / cards.size(),
                intervals,
                subjects
        );
    }

    public List<TopicStats> getTopicStats(Subject subject) {
        return tracker.getTopicStats(subject);
    }

    /**
     * Reviewed topics of {@code subject} whose lifetime accuracy is below {@code threshold}, weakest first.
     */
    public List<TopicStats> identifyWeakTopics(Subject subject, double threshold) {
        if (subject == null) {
            throw new ValidationException("subject", "Subject is required");
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new ValidationException("threshold", "Threshold must be between 0 and 1, got " + threshold);
        }
        return tracker.getTopicStats(subject).stream()
                .filter(ts -> ts.totalReviews() > 0 && ts.accuracy() < threshold)
                .sorted(Comparator.comparingDouble(TopicStats::accuracy).thenComparing(TopicStats::topic))
                .toList();
    }

    /**
     * Number of scheduled cards falling due on each of the next {@code days} days. Overdue cards are
     * counted on today.
     */
    public List<ForecastDay> forecast(int days) {
        if (days < 1 || days > MAX_FORECAST_DAYS) {
            throw new ValidationException("days", "Forecast days must be between 1 and " + MAX_FORECAST_DAYS);
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate horizon = today.plusDays(days - 1L);
        long[] counts = new long[days];
        for (Card card : cardStore.queryDue(horizon, CardFilter.ACTIVE)) {
            LocalDate due = card.state().dueDate();
            if (due == null) continue;
            long offset = Math.max(0, ChronoUnit.DAYS.between(today, due));
            if (offset < days) {
                counts[(int) offset]++;
            }
        }
        List<ForecastDay> out = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            out.add(new ForecastDay(today.plusDays(i), counts[i]));
        }
        return out;
    }

    static String bucketOf(SchedulingState state) {
        if (state.isNew()) return BUCKET_NEW;
        int interval = state.intervalDays();
        if (interval <= 1) return BUCKET_1D;
        if (interval <= 7) return BUCKET_2_7D;
        if (interval <= 21) return BUCKET_8_21D;
        if (interval <= 60) return BUCKET_22_60D;
        return BUCKET_60D_PLUS;
    }

    private static Map<String, Long> emptyDistribution() {
        Map<String, Long> m = new LinkedHashMap<>();
        for (String b : List.of(BUCKET_NEW, BUCKET_1D, BUCKET_2_7D, BUCKET_8_21D, BUCKET_22_60D, BUCKET_60D_PLUS)) {
            m.put(b, 0L);
        }
        return m;
    }
}
