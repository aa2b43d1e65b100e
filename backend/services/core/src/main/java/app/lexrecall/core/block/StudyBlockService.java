package app.lexrecall.core.block;

import app.lexrecall.core.card.domain.Card;
import app.lexrecall.core.card.domain.CardFilter;
import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.config.BlockProps;
import app.lexrecall.core.review.api.CardStorePort;
import app.lexrecall.core.review.service.PerformanceTracker;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Service
public class StudyBlockService {

    private final CardStorePort cardStore;
    private final PerformanceTracker tracker;
    private final BlockGenerator generator;
    private final BlockProps props;
    private final Clock clock;

    public StudyBlockService(CardStorePort cardStore,
                             PerformanceTracker tracker,
                             BlockGenerator generator,
                             BlockProps props,
                             Clock clock) {
        this.cardStore = cardStore;
        this.tracker = tracker;
        this.generator = generator;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @param blockSize {@code null} falls back to the configured default size
     */
    public List<Card> getStudyBlock(Integer blockSize,
                                    Subject subject,
                                    boolean includeNew,
                                    boolean includeReview,
                                    Integer difficultyTarget) {
        LocalDate today = LocalDate.now(clock);
        CardFilter filter = subject == null ? CardFilter.ACTIVE : CardFilter.subject(subject);
        BlockRequest request = new BlockRequest(
                blockSize == null ? props.defaultSize() : blockSize,
                subject,
                includeNew,
                includeReview,
                difficultyTarget
        );

        List<Card> pool = new ArrayList<>();
        if (includeReview) {
            pool.addAll(cardStore.queryDue(today, filter));
        }
        if (includeNew) {
            pool.addAll(cardStore.queryNew(filter));
        }
        return generator.generateBlock(pool, request, today, tracker::masteryLevel);
    }
}
