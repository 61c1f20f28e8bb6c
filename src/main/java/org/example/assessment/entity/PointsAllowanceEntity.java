package org.example.assessment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigInteger;

@Entity
@Table(
        name = "points_allowances",
        uniqueConstraints = @UniqueConstraint(columnNames = {"owner_id", "spender_id"})
)
public class PointsAllowanceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "owner_id", nullable = false, length = 120)
    private String ownerId;

    @Column(name = "spender_id", nullable = false, length = 120)
    private String spenderId;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger amount = BigInteger.ZERO;

    public PointsAllowanceEntity() {
    }

    public PointsAllowanceEntity(String ownerId, String spenderId) {
        this.ownerId = ownerId;
        this.spenderId = spenderId;
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

    public String getSpenderId() {
        return spenderId;
    }

    public void setSpenderId(String spenderId) {
        this.spenderId = spenderId;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
