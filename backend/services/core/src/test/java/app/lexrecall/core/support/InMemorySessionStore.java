package app.lexrecall.core.support;

import app.lexrecall.core.common.error.NotFoundException;
import app.lexrecall.core.review.api.StudySessionPort;
import app.lexrecall.core.review.domain.StudySession;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

public class InMemorySessionStore implements StudySessionPort {

    private final Map<UUID, StudySession> sessions = new HashMap<>();

    @Override
    public synchronized StudySession create(StudySession session) {
        sessions.put(session.id(), session);
        return session;
    }

    @Override
    public synchronized StudySession get(UUID sessionId) {
        StudySession s = sessions.get(sessionId);
        if (s == null) throw NotFoundException.session(sessionId);
        return s;
    }

    @Override
    public StudySession lock(UUID sessionId) {
        return get(sessionId);
    }

    @Override
    public synchronized StudySession save(StudySession session) {
        sessions.put(session.id(), session);
        return session;
    }
}
