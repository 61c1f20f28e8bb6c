package org.example.assessment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "authorized_callers")
public class AuthorizedCallerEntity {

    @Id
    @Column(name = "caller_id", length = 120)
    private String callerId;

    @Column(length = 120)
    private String addedBy;

    @Column(nullable = false)
    private LocalDateTime authorizedAt;

    public AuthorizedCallerEntity() {
    }

    public AuthorizedCallerEntity(String callerId, String addedBy) {
        this.callerId = callerId;
        this.addedBy = addedBy;
    }

    public String getCallerId() {
        return callerId;
    }

    public void setCallerId(String callerId) {
        this.callerId = callerId;
    }

    public String getAddedBy() {
        return addedBy;
    }

    public void setAddedBy(String addedBy) {
        this.addedBy = addedBy;
    }

    public LocalDateTime getAuthorizedAt() {
        return authorizedAt;
    }

    public void setAuthorizedAt(LocalDateTime authorizedAt) {
        this.authorizedAt = authorizedAt;
    }

    @PrePersist
    public void prePersist() {
        if (authorizedAt == null) {
            authorizedAt = LocalDateTime.now();
        }
    }
}
