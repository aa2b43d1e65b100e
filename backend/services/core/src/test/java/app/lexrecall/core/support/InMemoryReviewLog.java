package app.lexrecall.core.support;

import app.lexrecall.core.review.api.ReviewLogPort;
import app.lexrecall.core.review.domain.ReviewRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public class InMemoryReviewLog implements ReviewLogPort {

    private final List<ReviewRecord> records = new ArrayList<>();

    @Override
    public synchronized ReviewRecord append(ReviewRecord record) {
        records.add(record);
        return record;
    }

    @Override
    public synchronized List<ReviewRecord> findByCard(UUID cardId) {
        return records.stream().filter(r -> r.cardId().equals(cardId)).toList();
    }

    @Override
    public synchronized List<ReviewRecord> findBySession(UUID sessionId) {
        return records.stream().filter(r -> r.sessionId().equals(sessionId)).toList();
    }

    @Override
    public synchronized List<ReviewRecord> findAll() {
        return List.copyOf(records);
    }
}
