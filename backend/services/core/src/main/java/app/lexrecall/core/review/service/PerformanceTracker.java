package app.lexrecall.core.review.service;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.config.PerformanceProps;
import app.lexrecall.core.review.domain.CardPerformance;
import app.lexrecall.core.review.domain.ReviewRecord;
import app.lexrecall.core.review.domain.TopicStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory materialized view over the review log: lifetime counters per topic and per card plus a
 * rolling window per topic. The window is trimmed on every append and every read, so the reported
 * 7-day accuracy always reflects the clock at the time of the call.
 * <p>
 * The view is disposable; {@link #rebuild(Supplier)} recreates it from the ordered log.
 */
@Component
public class PerformanceTracker {

    private static final Logger log = LoggerFactory.getLogger(PerformanceTracker.class);

    private final Clock clock;
    private final PerformanceProps props;

    private final ReadWriteLock rebuildLock = new ReentrantReadWriteLock();
    private volatile ConcurrentMap<Topic, TopicAccumulator> topics = new ConcurrentHashMap<>();
    private volatile ConcurrentMap<UUID, CardAccumulator> cards = new ConcurrentHashMap<>();

    private final Object pendingLock = new Object();
    // records seen while a rebuild is reading the log; null when no rebuild runs
    private List<ReviewRecord> pending;

    public PerformanceTracker(Clock clock, PerformanceProps props) {
        this.clock = clock;
        this.props = props;
    }

    public void onReviewRecorded(ReviewRecord record) {
        rebuildLock.readLock().lock();
        try {
            apply(record, topics, cards);
            synchronized (pendingLock) {
                if (pending != null) {
                    pending.add(record);
                }
            }
        } finally {
            rebuildLock.readLock().unlock();
        }
    }

    /**
     * Replaces the view with one built from {@code source}. Records reported through
     * {@link #onReviewRecorded} while the source is being read are replayed onto the new view unless the
     * source already returned them.
     */
    public synchronized void rebuild(Supplier<List<ReviewRecord>> source) {
        synchronized (pendingLock) {
            pending = new ArrayList<>();
        }
        List<ReviewRecord> history;
        try {
            history = source.get();
        } catch (RuntimeException e) {
            synchronized (pendingLock) {
                pending = null;
            }
            throw e;
        }

        ConcurrentMap<Topic, TopicAccumulator> freshTopics = new ConcurrentHashMap<>();
        ConcurrentMap<UUID, CardAccumulator> freshCards = new ConcurrentHashMap<>();
        Set<UUID> seen = new HashSet<>();
        for (ReviewRecord r : history) {
            seen.add(r.id());
            apply(r, freshTopics, freshCards);
        }

        int replayed = 0;
        rebuildLock.writeLock().lock();
        try {
            synchronized (pendingLock) {
                for (ReviewRecord r : pending) {
                    if (seen.add(r.id())) {
                        apply(r, freshTopics, freshCards);
                        replayed++;
                    }
                }
                pending = null;
            }
            topics = freshTopics;
            cards = freshCards;
        } finally {
            rebuildLock.writeLock().unlock();
        }
        log.info("Performance view rebuilt reviews={} replayed={} topics={} cards={}",
                history.size(), replayed, freshTopics.size(), freshCards.size());
    }

    public TopicStats getTopicStats(Subject subject, Topic topic) {
        if (topic.subject() != subject) {
            throw new ValidationException("topic", "Topic " + topic.code() + " does not belong to " + subject.code());
        }
        TopicAccumulator acc = topics.get(topic);
        return acc == null ? TopicStats.empty(topic) : acc.snapshot(windowCutoff());
    }

    /**
     * Stats for every topic of {@code subject} that has at least one review, in catalogue order.
     */
    public List<TopicStats> getTopicStats(Subject subject) {
        Instant cutoff = windowCutoff();
        List<TopicStats> out = new ArrayList<>();
        for (Topic t : Topic.forSubject(subject)) {
            TopicAccumulator acc = topics.get(t);
            if (acc != null) {
                out.add(acc.snapshot(cutoff));
            }
        }
        return out;
    }

    public List<TopicStats> allTopicStats() {
        Instant cutoff = windowCutoff();
        return topics.values().stream()
                .map(acc -> acc.snapshot(cutoff))
                .sorted(Comparator.comparing(TopicStats::topic))
                .toList();
    }

    /**
     * Accuracy over the rolling window, across all topics or those of one subject. 0 when the window
     * holds no reviews.
     */
    public double get7DayAccuracy(Subject subject) {
        Instant cutoff = windowCutoff();
        long total = 0;
        long correct = 0;
        for (var e : topics.entrySet()) {
            if (subject != null && e.getKey().subject() != subject) continue;
            long[] counts = e.getValue().windowCounts(cutoff);
            total += counts[0];
            correct += counts[1];
        }
        return total == 0 ? 0.0 : (double) correct / total;
    }

    public CardPerformance getCardPerformance(UUID cardId) {
        CardAccumulator acc = cards.get(cardId);
        return acc == null ? CardPerformance.empty(cardId) : acc.snapshot();
    }

    /**
     * Mastery signal in [0,1] for the priority score: 1 for a mastered card, otherwise the mastery score
     * of the card's topic.
     */
    public double masteryLevel(Card card) {
        if (isCardMastered(card)) {
            return 1.0;
        }
        TopicAccumulator acc = topics.get(card.topic());
        return acc == null ? 0.0 : acc.masteryScore();
    }

    public boolean isCardMastered(Card card) {
        CardAccumulator acc = cards.get(card.id());
        if (acc == null) return false;
        return isMastered(card.state().repetitions(), acc.accuracy());
    }

    long totalReviews() {
        return cards.values().stream().mapToLong(CardAccumulator::total).sum();
    }

    long correctReviews() {
        return cards.values().stream().mapToLong(CardAccumulator::correct).sum();
    }

    private boolean isMastered(long repetitions, double accuracy) {
        return repetitions >= props.masteryRepetitions() && accuracy >= props.masteryAccuracy();
    }

    private Instant windowCutoff() {
        return clock.instant().minus(Duration.ofDays(props.windowDays()));
    }

    private void apply(ReviewRecord r,
                       ConcurrentMap<Topic, TopicAccumulator> topicMap,
                       ConcurrentMap<UUID, CardAccumulator> cardMap) {
        Instant cutoff = windowCutoff();
        topicMap.computeIfAbsent(r.topic(), TopicAccumulator::new).add(r.reviewedAt(), r.correct(), cutoff);
        cardMap.computeIfAbsent(r.cardId(), id -> new CardAccumulator(id)).add(r.correct(), r.repetitionsAfter());
    }

    private final class TopicAccumulator {
        private final Topic topic;
        private long total;
        private long correct;
        private final Deque<WindowEntry> window = new ArrayDeque<>();

        TopicAccumulator(Topic topic) {
            this.topic = topic;
        }

        synchronized void add(Instant at, boolean ok, Instant cutoff) {
            total++;
            if (ok) correct++;
            if (at != null && !at.isBefore(cutoff)) {
                window.addLast(new WindowEntry(at, ok));
            }
            evict(cutoff);
        }

        synchronized long[] windowCounts(Instant cutoff) {
            evict(cutoff);
            long ok = window.stream().filter(WindowEntry::correct).count();
            return new long[]{window.size(), ok};
        }

        synchronized double masteryScore() {
            return score(total, correct);
        }

        synchronized TopicStats snapshot(Instant cutoff) {
            long[] w = windowCounts(cutoff);
            double accuracy = total == 0 ? 0.0 : (double) correct / total;
            double acc7 = w[0] == 0 ? 0.0 : (double) w[1] / w[0];
            return new TopicStats(
                    topic.subject(),
                    topic,
                    total,
                    correct,
                    accuracy,
                    w[0],
                    acc7,
                    score(total, correct),
                    isMastered(correct, accuracy)
            );
        }

        private double score(long total, long correct) {
            if (total == 0) return 0.0;
            double accuracy = (double) correct / total;
            double repetitionPart = Math.min(1.0, (double) correct / props.masteryRepetitions());
            return repetitionPart * accuracy;
        }

        // entries can arrive out of order during a rebuild, so scan rather than pop from the head
        private void evict(Instant cutoff) {
            window.removeIf(e -> e.at().isBefore(cutoff));
        }
    }

    private final class CardAccumulator {
        private final UUID cardId;
        private long total;
        private long correct;
        private int repetitions;

        CardAccumulator(UUID cardId) {
            this.cardId = cardId;
        }

        synchronized void add(boolean ok, int repetitionsAfter) {
            total++;
            if (ok) correct++;
            repetitions = repetitionsAfter;
        }

        synchronized long total() {
            return total;
        }

        synchronized long correct() {
            return correct;
        }

        synchronized double accuracy() {
            return total == 0 ? 0.0 : (double) correct / total;
        }

        synchronized CardPerformance snapshot() {
            double accuracy = accuracy();
            return new CardPerformance(cardId, total, correct, repetitions, accuracy, isMastered(repetitions, accuracy));
        }
    }

    private record WindowEntry(Instant at, boolean correct) {
    }
}
