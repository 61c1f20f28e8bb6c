package org.example.assessment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "question_sets")
public class QuestionSetEntity {

    @Id
    @Column(name = "set_id", length = 128)
    private String setId;

    @Column(nullable = false, length = 66)
    private String contentHash;

    @Column(nullable = false)
    private int questionCount;

    @Column(nullable = false)
    private boolean active;

    // Insertion order; rows are never deleted so the index stays dense.
    @Column(nullable = false, unique = true)
    private long catalogIndex;

    @Column(nullable = false)
    private LocalDateTime submittedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public QuestionSetEntity() {
    }

    public QuestionSetEntity(String setId, String contentHash, int questionCount, long catalogIndex) {
        this.setId = setId;
        this.contentHash = contentHash;
        this.questionCount = questionCount;
        this.catalogIndex = catalogIndex;
        this.active = true;
    }

    public String getSetId() {
        return setId;
    }

    public void setSetId(String setId) {
        this.setId = setId;
    }

    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public int getQuestionCount() {
        return questionCount;
    }

    public void setQuestionCount(int questionCount) {
        this.questionCount = questionCount;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public long getCatalogIndex() {
        return catalogIndex;
    }

    public void setCatalogIndex(long catalogIndex) {
        this.catalogIndex = catalogIndex;
    }

    public LocalDateTime getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(LocalDateTime submittedAt) {
        this.submittedAt = submittedAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @PrePersist
    public void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (submittedAt == null) {
            submittedAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
