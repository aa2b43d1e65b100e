package app.lexrecall.core.block;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.Difficulty;
import app.lexrecall.core.config.PriorityProps;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;

/**
 * Urgency score for a candidate card:
 * {@code w1*dueness + w2*difficultyAlignment + w3*(1 - mastery) + w4*recencyGap}. Higher is more urgent.
 * Pure function of its arguments and the configured weights.
 */
@Component
public class PriorityScorer {

    private final PriorityProps props;
    private final ZoneId zone;

    public PriorityScorer(PriorityProps props, Clock clock) {
        this.props = props;
        this.zone = clock.getZone();
    }

    public double score(Card card, LocalDate today, Integer targetDifficulty, double masteryLevel) {
        return props.duenessWeight() * dueness(card, today)
                + props.difficultyWeight() * difficultyAlignment(card, targetDifficulty)
                + props.masteryWeight() * (1.0 - clamp01(masteryLevel))
                + props.recencyWeight() * recencyGap(card, today);
    }

    /**
     * 0 for unscheduled or not-yet-due cards. A card due today scores 0.5, growing linearly with days
     * overdue up to 1.0 at the configured cap.
     */
    public double dueness(Card card, LocalDate today) {
        LocalDate due = card.state().dueDate();
        if (due == null || due.isAfter(today)) {
            return 0.0;
        }
        long overdue = ChronoUnit.DAYS.between(due, today);
        int cap = props.overdueCapDays();
        return 0.5 + 0.5 * Math.min(overdue, cap) / cap;
    }

    public static double difficultyAlignment(Card card, Integer targetDifficulty) {
        if (targetDifficulty == null) {
            return 0.0;
        }
        int distance = Math.abs(card.difficulty().level() - targetDifficulty);
        return 1.0 - (double) distance / Difficulty.MAX_DISTANCE;
    }

    /**
     * Days since this card was last reviewed, normalised by the recency horizon. A card reviewed today
     * contributes nothing; a card never reviewed contributes the full weight.
     */
    public double recencyGap(Card card, LocalDate today) {
        if (card.state().lastReviewedAt() == null) {
            return 1.0;
        }
        LocalDate last = LocalDate.ofInstant(card.state().lastReviewedAt(), zone);
        long days = Math.max(0, ChronoUnit.DAYS.between(last, today));
        return Math.min(1.0, (double) days / props.recencyHorizonDays());
    }

    /**
     * Score descending, then earliest due date, then fewest repetitions, then insertion order.
     */
    public static Comparator<ScoredCard> ordering() {
        return Comparator.comparingDouble(ScoredCard::score).reversed()
                .thenComparing(sc -> sc.card().state().dueDate(), Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparingInt(sc -> sc.card().state().repetitions())
                .thenComparingInt(ScoredCard::position);
    }

    private static double clamp01(double v) {
        if (v < 0) return 0;
        if (v > 1) return 1;
        return v;
    }
}
