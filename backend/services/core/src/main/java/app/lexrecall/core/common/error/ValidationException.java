package app.lexrecall.core.common.error;

/**
 * Input rejected before any state was touched. The caller can fix the input and retry.
 */
public class ValidationException extends StudyException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }

    @Override
    public String errorCode() {
        return "VALIDATION_FAILED";
    }
}
