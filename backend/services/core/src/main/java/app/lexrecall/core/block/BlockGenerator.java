package app.lexrecall.core.block;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.Difficulty;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.common.error.ValidationException;
import app.lexrecall.core.config.BlockProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.ToDoubleFunction;

/**
 * Assembles a study block from a card pool.
 * <ol>
 *     <li>due cards, ranked by {@link PriorityScorer};</li>
 *     <li>new cards, round-robin across topics with a per-topic cap;</li>
 *     <li>a swap pass over the new cards that pulls the expected accuracy of the block into the
 *     configured band.</li>
 * </ol>
 * There is no randomness: the same pool, date and configuration always give the same block.
 */
@Component
public class BlockGenerator {

    private static final Logger log = LoggerFactory.getLogger(BlockGenerator.class);

    private final PriorityScorer scorer;
    private final BlockProps props;

    public BlockGenerator(PriorityScorer scorer, BlockProps props) {
        this.scorer = scorer;
        this.props = props;
    }

    public List<Card> generateBlock(Collection<Card> pool,
                                    BlockRequest request,
                                    LocalDate today,
                                    ToDoubleFunction<Card> masteryLevel) {
        validate(request);

        List<Candidate> due = new ArrayList<>();
        List<Candidate> fresh = new ArrayList<>();
        int position = 0;
        for (Card card : dedupe(pool)) {
            int pos = position++;
            if (card.archived()) continue;
            if (request.subjectFilter() != null && card.subject() != request.subjectFilter()) continue;

            if (request.includeReview() && card.state().isDueOn(today)) {
                due.add(new Candidate(card, pos));
            } else if (request.includeNew() && card.state().isNew()) {
                fresh.add(new Candidate(card, pos));
            }
        }

        int capacity = request.blockSize();
        List<Card> block = new ArrayList<>(capacity);
        Map<Topic, Integer> perTopic = new EnumMap<>(Topic.class);

        due.stream()
                .map(c -> new ScoredCard(c.card(), scorer.score(c.card(), today, request.difficultyTarget(),
                        masteryLevel.applyAsDouble(c.card())), c.position()))
                .sorted(PriorityScorer.ordering())
                .limit(capacity)
                .forEach(sc -> {
                    block.add(sc.card());
                    perTopic.merge(sc.card().topic(), 1, Integer::sum);
                });

        int dueTaken = block.size();
        List<Candidate> leftoverNew = new ArrayList<>();
        if (block.size() < capacity && !fresh.isEmpty()) {
            int topicCap = topicCap(capacity);
            fillNewRoundRobin(fresh, request.difficultyTarget(), capacity, topicCap, block, perTopic, leftoverNew);
            balanceAccuracy(block, dueTaken, leftoverNew, perTopic, topicCap);
        }

        List<Card> out = List.copyOf(dedupe(block));
        log.debug("Generated block size={} requested={} due={} new={} subject={}",
                out.size(), capacity, dueTaken, out.size() - dueTaken, request.subjectFilter());
        return out;
    }

    int topicCap(int blockSize) {
        return Math.max(1, (int) Math.ceil(blockSize * props.maxTopicShare()));
    }

    double expectedAccuracy(List<Card> cards) {
        if (cards.isEmpty()) return 0.0;
        double sum = 0;
        for (Card c : cards) {
            sum += props.expectedAccuracy(c.difficulty().level());
        }
        return sum / cards.size();
    }

    private void validate(BlockRequest request) {
        if (request.blockSize() < 1) {
            throw new ValidationException("blockSize", "Block size must be positive, got " + request.blockSize());
        }
        if (request.blockSize() > props.maxSize()) {
            throw new ValidationException("blockSize", "Block size must not exceed " + props.maxSize());
        }
        Integer target = request.difficultyTarget();
        if (target != null && (target < Difficulty.FUNDAMENTAL.level() || target > Difficulty.EXPERT.level())) {
            throw new ValidationException("difficulty", "Difficulty target must be between 1 and 5, got " + target);
        }
    }

    private void fillNewRoundRobin(List<Candidate> fresh,
                                   Integer target,
                                   int capacity,
                                   int topicCap,
                                   List<Card> block,
                                   Map<Topic, Integer> perTopic,
                                   List<Candidate> leftover) {
        Map<Topic, Deque<Candidate>> queues = new LinkedHashMap<>();
        for (Candidate c : fresh) {
            queues.computeIfAbsent(c.card().topic(), t -> new ArrayDeque<>()).add(c);
        }
        Comparator<Candidate> order = newCardOrder(target);
        for (var e : queues.entrySet()) {
            List<Candidate> sorted = new ArrayList<>(e.getValue());
            sorted.sort(order);
            e.setValue(new ArrayDeque<>(sorted));
        }

        boolean progressed = true;
        while (block.size() < capacity && progressed) {
            progressed = false;
            for (var e : queues.entrySet()) {
                if (block.size() >= capacity) break;
                Deque<Candidate> q = e.getValue();
                if (q.isEmpty() || perTopic.getOrDefault(e.getKey(), 0) >= topicCap) continue;
                Candidate next = q.pollFirst();
                block.add(next.card());
                perTopic.merge(e.getKey(), 1, Integer::sum);
                progressed = true;
            }
        }

        for (Deque<Candidate> q : queues.values()) {
            leftover.addAll(q);
        }
        leftover.sort(Comparator.comparingInt(Candidate::position));
    }

    /**
     * Swaps new cards in the block for leftover new cards while that moves the expected accuracy of the
     * whole block closer to the band. Due cards are never swapped out. Every accepted swap strictly
     * shrinks the distance to the band, so the loop terminates.
     */
    private void balanceAccuracy(List<Card> block,
                                 int firstNewIndex,
                                 List<Candidate> leftover,
                                 Map<Topic, Integer> perTopic,
                                 int topicCap) {
        double low = props.accuracyBandLow();
        double high = props.accuracyBandHigh();

        while (!leftover.isEmpty() && firstNewIndex < block.size()) {
            double mean = expectedAccuracy(block);
            double distance = bandDistance(mean, low, high);
            if (distance == 0.0) return;
            boolean tooEasy = mean > high;

            int outIndex = pickOut(block, firstNewIndex, tooEasy);
            Card out = block.get(outIndex);
            double outAcc = props.expectedAccuracy(out.difficulty().level());

            Candidate best = null;
            double bestDistance = distance;
            for (Candidate c : leftover) {
                Topic topic = c.card().topic();
                int count = perTopic.getOrDefault(topic, 0) - (topic == out.topic() ? 1 : 0);
                if (count >= topicCap) continue;
                double inAcc = props.expectedAccuracy(c.card().difficulty().level());
                double swapped = mean + (inAcc - outAcc) / block.size();
                double d = bandDistance(swapped, low, high);
                if (d < bestDistance) {
                    best = c;
                    bestDistance = d;
                }
            }
            if (best == null) return;

            block.set(outIndex, best.card());
            perTopic.merge(out.topic(), -1, Integer::sum);
            perTopic.merge(best.card().topic(), 1, Integer::sum);
            removeCandidate(leftover, best.card().id());
        }
    }

    // easiest new card when the block is too easy, hardest otherwise; the later card loses ties
    private int pickOut(List<Card> block, int firstNewIndex, boolean tooEasy) {
        int idx = firstNewIndex;
        for (int i = firstNewIndex + 1; i < block.size(); i++) {
            int cand = block.get(i).difficulty().level();
            int cur = block.get(idx).difficulty().level();
            if (tooEasy ? cand <= cur : cand >= cur) {
                idx = i;
            }
        }
        return idx;
    }

    private static double bandDistance(double mean, double low, double high) {
        if (mean < low) return low - mean;
        if (mean > high) return mean - high;
        return 0.0;
    }

    private static void removeCandidate(List<Candidate> leftover, UUID cardId) {
        Iterator<Candidate> it = leftover.iterator();
        while (it.hasNext()) {
            if (it.next().card().id().equals(cardId)) {
                it.remove();
                return;
            }
        }
    }

    private static Comparator<Candidate> newCardOrder(Integer target) {
        if (target == null) {
            return Comparator.<Candidate>comparingInt(c -> c.card().difficulty().level())
                    .thenComparingInt(Candidate::position);
        }
        return Comparator.<Candidate>comparingDouble(c -> PriorityScorer.difficultyAlignment(c.card(), target))
                .reversed()
                .thenComparingInt(Candidate::position);
    }

    private static Collection<Card> dedupe(Collection<Card> cards) {
        Map<UUID, Card> unique = new LinkedHashMap<>();
        for (Card c : cards) {
            unique.putIfAbsent(c.id(), c);
        }
        return unique.values();
    }

    private record Candidate(Card card, int position) {
    }
}
