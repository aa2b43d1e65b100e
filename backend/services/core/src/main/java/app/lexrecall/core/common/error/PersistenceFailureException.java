package app.lexrecall.core.common.error;

public class PersistenceFailureException extends StudyException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "PERSISTENCE_FAILURE";
    }
}
