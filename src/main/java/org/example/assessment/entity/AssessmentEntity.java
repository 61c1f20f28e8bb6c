package org.example.assessment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * One live record per user; restart resets it to {@link AssessmentStatus#NOT_STARTED}.
 */
@Entity
@Table(name = "assessments")
public class AssessmentEntity {

    @Id
    @Column(name = "user_id", length = 120)
    private String userId;

    @Column(length = 128)
    private String questionSetId;

    @Column(length = 66)
    private String answersHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AssessmentStatus status;

    @Column
    private Integer score;

    @Column(length = 66)
    private String resultHash;

    @Column(length = 66)
    private String pendingRequestId;

    @Column(precision = 78, scale = 0)
    private BigInteger rewardAmount;

    @Column
    private LocalDateTime startedAt;

    @Column
    private LocalDateTime completedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public AssessmentEntity() {
    }

    public AssessmentEntity(String userId) {
        this.userId = userId;
        this.status = AssessmentStatus.NOT_STARTED;
    }

    public void reset() {
        questionSetId = null;
        answersHash = null;
        status = AssessmentStatus.NOT_STARTED;
        score = null;
        resultHash = null;
        pendingRequestId = null;
        rewardAmount = null;
        startedAt = null;
        completedAt = null;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getQuestionSetId() {
        return questionSetId;
    }

    public void setQuestionSetId(String questionSetId) {
        this.questionSetId = questionSetId;
    }

    public String getAnswersHash() {
        return answersHash;
    }

    public void setAnswersHash(String answersHash) {
        this.answersHash = answersHash;
    }

    public AssessmentStatus getStatus() {
        return status;
    }

    public void setStatus(AssessmentStatus status) {
        this.status = status;
    }

    public Integer getScore() {
        return score;
    }

    public void setScore(Integer score) {
        this.score = score;
    }

    public String getResultHash() {
        return resultHash;
    }

    public void setResultHash(String resultHash) {
        this.resultHash = resultHash;
    }

    public String getPendingRequestId() {
        return pendingRequestId;
    }

    public void setPendingRequestId(String pendingRequestId) {
        this.pendingRequestId = pendingRequestId;
    }

    public BigInteger getRewardAmount() {
        return rewardAmount;
    }

    public void setRewardAmount(BigInteger rewardAmount) {
        this.rewardAmount = rewardAmount;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(LocalDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(LocalDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = LocalDateTime.now();
    }
}
