package org.example.assessment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Single-row table holding global owner-mutable settings.
 */
@Entity
@Table(name = "ledger_settings")
public class LedgerSettingsEntity {

    public static final String GLOBAL_ID = "global";

    @Id
    @Column(length = 32)
    private String id = GLOBAL_ID;

    @Column(name = "owner_id", nullable = false, length = 120)
    private String ownerId;

    @Column(nullable = false)
    private int passingScoreThreshold;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger maxRewardUnits;

    @Column(nullable = false)
    private boolean oracleVerificationEnabled;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public LedgerSettingsEntity() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public int getPassingScoreThreshold() {
        return passingScoreThreshold;
    }

    public void setPassingScoreThreshold(int passingScoreThreshold) {
        this.passingScoreThreshold = passingScoreThreshold;
    }

    public BigInteger getMaxRewardUnits() {
        return maxRewardUnits;
    }

    public void setMaxRewardUnits(BigInteger maxRewardUnits) {
        this.maxRewardUnits = maxRewardUnits;
    }

    public boolean isOracleVerificationEnabled() {
        return oracleVerificationEnabled;
    }

    public void setOracleVerificationEnabled(boolean oracleVerificationEnabled) {
        this.oracleVerificationEnabled = oracleVerificationEnabled;
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
