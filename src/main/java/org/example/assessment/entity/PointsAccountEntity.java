package org.example.assessment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Balance row, created on an identity's first non-zero credit; its existence marks a holder.
 */
@Entity
@Table(name = "points_accounts")
public class PointsAccountEntity {

    @Id
    @Column(name = "holder_id", length = 120)
    private String holderId;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger balance = BigInteger.ZERO;

    @Column(nullable = false, unique = true)
    private long holderIndex;

    @Column(nullable = false)
    private LocalDateTime firstCreditedAt;

    public PointsAccountEntity() {
    }

    public PointsAccountEntity(String holderId, long holderIndex) {
        this.holderId = holderId;
        this.holderIndex = holderIndex;
    }

    public String getHolderId() {
        return holderId;
    }

    public void setHolderId(String holderId) {
        this.holderId = holderId;
    }

    public BigInteger getBalance() {
        return balance;
    }

    public void setBalance(BigInteger balance) {
        this.balance = balance;
    }

    public long getHolderIndex() {
        return holderIndex;
    }

    public void setHolderIndex(long holderIndex) {
        this.holderIndex = holderIndex;
    }

    public LocalDateTime getFirstCreditedAt() {
        return firstCreditedAt;
    }

    public void setFirstCreditedAt(LocalDateTime firstCreditedAt) {
        this.firstCreditedAt = firstCreditedAt;
    }

    @PrePersist
    public void prePersist() {
        if (firstCreditedAt == null) {
            firstCreditedAt = LocalDateTime.now();
        }
    }
}
