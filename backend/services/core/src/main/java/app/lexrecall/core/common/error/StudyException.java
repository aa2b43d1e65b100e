package app.lexrecall.core.common.error;

/**
 * Base type for every failure the study core reports to its callers.
 */
public abstract class StudyException extends RuntimeException {

    protected StudyException(String message) {
        super(message);
    }

    protected StudyException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorCode();
}
