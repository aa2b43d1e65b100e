package app.lexrecall.core.card.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A learning item together with its scheduling state. {@code version} is the optimistic-concurrency
 * token handed back to {@code CardStorePort#update}.
 */
public record Card(
        UUID id,
        Subject subject,
        Topic topic,
        String conceptName,
        String question,
        String answer,
        Difficulty difficulty,
        Set<String> tags,
        Instant createdAt,
        boolean archived,
        SchedulingState state,
        long version
) {
    public Card {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(difficulty, "difficulty");
        Objects.requireNonNull(state, "state");
        if (topic.subject() != subject) {
            throw new IllegalArgumentException("Topic " + topic + " does not belong to " + subject);
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public Card withState(SchedulingState newState, long newVersion) {
        return new Card(id, subject, topic, conceptName, question, answer, difficulty, tags, createdAt, archived, newState, newVersion);
    }

    public Card archive() {
        return new Card(id, subject, topic, conceptName, question, answer, difficulty, tags, createdAt, true, state, version);
    }
}
