package app.lexrecall.core.common.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the study error taxonomy onto HTTP responses with a stable JSON body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.warn("Rejected request field={} message={}", ex.field(), ex.getMessage());
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.errorCode());
        if (ex.field() != null) {
            body.put("field", ex.field());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleBeanValidation(MethodArgumentNotValidException ex) {
        var fieldError = ex.getBindingResult().getFieldError();
        String field = fieldError == null ? null : fieldError.getField();
        String message = fieldError == null ? "Invalid request" : field + " " + fieldError.getDefaultMessage();
        log.warn("Rejected request field={} message={}", field, message);
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, message, "VALIDATION_FAILED");
        if (field != null) {
            body.put("field", field);
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Rejected unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(HttpStatus.BAD_REQUEST, "Request body is missing or malformed", "MALFORMED_REQUEST"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Rejected request param={} value={}", ex.getName(), ex.getValue());
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST,
                "Invalid value '" + ex.getValue() + "' for " + ex.getName(), "VALIDATION_FAILED");
        body.put("field", ex.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body(HttpStatus.NOT_FOUND, ex.getMessage(), ex.errorCode()));
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ConcurrencyConflictException ex) {
        log.warn("Concurrent update cardId={}", ex.cardId());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(body(HttpStatus.CONFLICT, ex.getMessage(), ex.errorCode()));
    }

    @ExceptionHandler(PersistenceFailureException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(PersistenceFailureException ex) {
        log.error("Persistence failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body(HttpStatus.SERVICE_UNAVAILABLE, "Storage is unavailable, nothing was saved", ex.errorCode()));
    }

    private static Map<String, Object> body(HttpStatus status, String message, String errorCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("errorCode", errorCode);
        body.put("status", status.value());
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
