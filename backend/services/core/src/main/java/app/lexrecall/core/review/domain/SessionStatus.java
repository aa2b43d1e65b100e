package app.lexrecall.core.review.domain;

public enum SessionStatus {
    ACTIVE, COMPLETED, ABANDONED
}
