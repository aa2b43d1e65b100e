package app.lexrecall.core.review.entity;

import app.lexrecall.core.review.domain.SessionStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "study_sessions", schema = "app_core")
public class StudySessionEntity {

    @Id
    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private SessionStatus status;

    @Column(name = "review_count", nullable = false)
    private int reviewCount;

    @Column(name = "correct_count", nullable = false)
    private int correctCount;

    @Column(name = "confidence_total", nullable = false)
    private int confidenceTotal;

    @Column(name = "time_taken_seconds", nullable = false)
    private long timeTakenSeconds;

    @Column(name = "accuracy")
    private Double accuracy;

    @Column(name = "avg_confidence")
    private Double avgConfidence;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Version
    @Column(name = "row_version", nullable = false)
    private Long rowVersion;

    public UUID getSessionId() {
        return sessionId;
    }

    public void setSessionId(UUID sessionId) {
        this.sessionId = sessionId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(Instant endedAt) {
        this.endedAt = endedAt;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public void setStatus(SessionStatus status) {
        this.status = status;
    }

    public int getReviewCount() {
        return reviewCount;
    }

    public void setReviewCount(int reviewCount) {
        this.reviewCount = reviewCount;
    }

    public int getCorrectCount() {
        return correctCount;
    }

    public void setCorrectCount(int correctCount) {
        this.correctCount = correctCount;
    }

    public int getConfidenceTotal() {
        return confidenceTotal;
    }

    public void setConfidenceTotal(int confidenceTotal) {
        this.confidenceTotal = confidenceTotal;
    }

    public long getTimeTakenSeconds() {
        return timeTakenSeconds;
    }

    public void setTimeTakenSeconds(long timeTakenSeconds) {
        this.timeTakenSeconds = timeTakenSeconds;
    }

    public Double getAccuracy() {
        return accuracy;
    }

    public void setAccuracy(Double accuracy) {
        this.accuracy = accuracy;
    }

    public Double getAvgConfidence() {
        return avgConfidence;
    }

    public void setAvgConfidence(Double avgConfidence) {
        this.avgConfidence = avgConfidence;
    }

    public Double getQualityScore() {
        return qualityScore;
    }

    public void setQualityScore(Double qualityScore) {
        this.qualityScore = qualityScore;
    }

    public Long getRowVersion() {
        return rowVersion;
    }
}
