package org.example.assessment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * Outstanding evaluation request; the row is deleted when its callback is consumed.
 */
@Entity
@Table(
        name = "oracle_requests",
        indexes = @Index(name = "idx_oracle_requests_user", columnList = "user_id")
)
public class OracleRequestEntity {

    @Id
    @Column(name = "request_id", length = 66)
    private String requestId;

    @Column(name = "user_id", nullable = false, length = 120)
    private String userId;

    @Column(nullable = false, length = 128)
    private String questionSetId;

    @Column(nullable = false)
    private LocalDateTime issuedAt;

    public OracleRequestEntity() {
    }

    public OracleRequestEntity(String requestId, String userId, String questionSetId) {
        this.requestId = requestId;
        this.userId = userId;
        this.questionSetId = questionSetId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
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

    public LocalDateTime getIssuedAt() {
        return issuedAt;
    }

    public void setIssuedAt(LocalDateTime issuedAt) {
        this.issuedAt = issuedAt;
    }

    @PrePersist
    public void prePersist() {
        if (issuedAt == null) {
            issuedAt = LocalDateTime.now();
        }
    }
}
