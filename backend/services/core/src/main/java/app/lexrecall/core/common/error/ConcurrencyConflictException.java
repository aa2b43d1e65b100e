package app.lexrecall.core.common.error;

import java.util.UUID;

/**
 * The stored card moved on since it was read. Re-read and retry; nothing was written.
 */
public class ConcurrencyConflictException extends StudyException {

    private final UUID cardId;

    public ConcurrencyConflictException(UUID cardId, long expectedVersion) {
        super("Card " + cardId + " was modified concurrently (expected version " + expectedVersion + ")");
        this.cardId = cardId;
    }

    public ConcurrencyConflictException(UUID cardId, Throwable cause) {
        super("Card " + cardId + " was modified concurrently", cause);
        this.cardId = cardId;
    }

    public UUID cardId() {
        return cardId;
    }

    @Override
    public String errorCode() {
        return "CONCURRENT_MODIFICATION";
    }
}
