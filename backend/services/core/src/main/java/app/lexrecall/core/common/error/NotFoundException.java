package app.lexrecall.core.common.error;

import java.util.UUID;

public class NotFoundException extends StudyException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException card(UUID cardId) {
        return new NotFoundException("Card not found: " + cardId);
    }

    public static NotFoundException session(UUID sessionId) {
        return new NotFoundException("Study session not found: " + sessionId);
    }

    @Override
    public String errorCode() {
        return "NOT_FOUND";
    }
}
