package app.lexrecall.core.review.entity;

import app.lexrecall.core.card.domain.Subject;
import app.lexrecall.core.card.domain.Topic;
import app.lexrecall.core.review.domain.Confidence;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "review_records", schema = "app_core")
public class ReviewRecordEntity {

    @Id
    @Column(name = "review_id", nullable = false)
    private UUID reviewId;

    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "subject", nullable = false)
    private Subject subject;

    @Enumerated(EnumType.STRING)
    @Column(name = "topic", nullable = false)
    private Topic topic;

    @Column(name = "reviewed_at", nullable = false)
    private Instant reviewedAt;

    @Column(name = "raw_quality", nullable = false)
    private short rawQuality;

    @Enumerated(EnumType.STRING)
    @Column(name = "confidence", nullable = false)
    private Confidence confidence;

    @Column(name = "is_correct", nullable = false)
    private boolean correct;

    @Column(name = "time_taken_seconds")
    private Integer timeTakenSeconds;

    @Column(name = "adjusted_quality", nullable = false)
    private double adjustedQuality;

    @Column(name = "repetitions_after", nullable = false)
    private int repetitionsAfter;

    @Column(name = "interval_days_after", nullable = false)
    private int intervalDaysAfter;

    @Column(name = "ease_factor_after", nullable = false)
    private double easeFactorAfter;

    public UUID getReviewId() {
        return reviewId;
    }

    public void setReviewId(UUID reviewId) {
        this.reviewId = reviewId;
    }

    public UUID getCardId() {
        return cardId;
    }

    public void setCardId(UUID cardId) {
        this.cardId = cardId;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public void setSessionId(UUID sessionId) {
        this.sessionId = sessionId;
    }

    public Subject getSubject() {
        return subject;
    }

    public void setSubject(Subject subject) {
        this.subject = subject;
    }

    public Topic getTopic() {
        return topic;
    }

    public void setTopic(Topic topic) {
        this.topic = topic;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public void setReviewedAt(Instant reviewedAt) {
        this.reviewedAt = reviewedAt;
    }

    public short getRawQuality() {
        return rawQuality;
    }

    public void setRawQuality(short rawQuality) {
        this.rawQuality = rawQuality;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public void setConfidence(Confidence confidence) {
        this.confidence = confidence;
    }

    public boolean isCorrect() {
        return correct;
    }

    public void setCorrect(boolean correct) {
        this.correct = correct;
    }

    public Integer getTimeTakenSeconds() {
        return timeTakenSeconds;
    }

    public void setTimeTakenSeconds(Integer timeTakenSeconds) {
        this.timeTakenSeconds = timeTakenSeconds;
    }

    public double getAdjustedQuality() {
        return adjustedQuality;
    }

    public void setAdjustedQuality(double adjustedQuality) {
        this.adjustedQuality = adjustedQuality;
    }

    public int getRepetitionsAfter() {
        return repetitionsAfter;
    }

    public void setRepetitionsAfter(int repetitionsAfter) {
        this.repetitionsAfter = repetitionsAfter;
    }

    public int getIntervalDaysAfter() {
        return intervalDaysAfter;
    }

    public void setIntervalDaysAfter(int intervalDaysAfter) {
        this.intervalDaysAfter = intervalDaysAfter;
    }

    public double getEaseFactorAfter() {
        return easeFactorAfter;
    }

    public void setEaseFactorAfter(double easeFactorAfter) {
        this.easeFactorAfter = easeFactorAfter;
    }
}
