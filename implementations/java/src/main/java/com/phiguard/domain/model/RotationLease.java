package com.phiguard.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Advisory lease giving one orchestrator instance the right to advance a job's cursor.
 */
@Entity
@Table(name = "rotation_leases")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor
public class RotationLease {

    @Id
    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "owner", nullable = false, length = 128)
    private String owner;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public boolean isHeldBy(String candidate, Instant now) {
        return owner.equals(candidate) && expiresAt.isAfter(now);
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
