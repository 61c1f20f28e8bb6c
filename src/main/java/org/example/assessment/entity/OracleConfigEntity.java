package org.example.assessment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "oracle_config")
public class OracleConfigEntity {

    public static final String GLOBAL_ID = "global";

    @Id
    @Column(length = 32)
    private String id = GLOBAL_ID;

    @Column(nullable = false)
    private long subscriptionId;

    @Column(name = "encrypted_secrets", length = 8192)
    private byte[] encryptedSecrets;

    @Column(length = 66)
    private String donId;

    @Column(name = "evaluation_source", columnDefinition = "TEXT")
    private String evaluationSource;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public OracleConfigEntity() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public long getSubscriptionId() {
        return subscriptionId;
    }

    public void setSubscriptionId(long subscriptionId) {
        this.subscriptionId = subscriptionId;
    }

    public byte[] getEncryptedSecrets() {
        return encryptedSecrets;
    }

    public void setEncryptedSecrets(byte[] encryptedSecrets) {
        this.encryptedSecrets = encryptedSecrets;
    }

    public String getDonId() {
        return donId;
    }

    public void setDonId(String donId) {
        this.donId = donId;
    }

    public String getEvaluationSource() {
        return evaluationSource;
    }

    public void setEvaluationSource(String evaluationSource) {
        this.evaluationSource = evaluationSource;
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
