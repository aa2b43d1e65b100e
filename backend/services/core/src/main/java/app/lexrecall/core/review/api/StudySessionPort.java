package app.lexrecall.core.review.api;

import app.lexrecall.core.review.domain.StudySession;

import java.util.UUID;

public interface StudySessionPort {

    StudySession create(StudySession session);

    /**
     * @throws app.lexrecall.core.common.error.NotFoundException for an unknown id
     */
    StudySession get(UUID sessionId);

    /**
     * Same as {@link #get(UUID)} but holds a write lock on the session until the surrounding
     * transaction ends, so concurrent reviews in one session do not lose counter updates.
     */
    StudySession lock(UUID sessionId);

    StudySession save(StudySession session);
}
