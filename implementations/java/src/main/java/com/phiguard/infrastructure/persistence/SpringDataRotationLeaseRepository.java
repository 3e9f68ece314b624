package com.phiguard.infrastructure.persistence;

import com.phiguard.domain.model.RotationLease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface SpringDataRotationLeaseRepository extends JpaRepository<RotationLease, UUID> {

    /**
     * PostgreSQL upsert: inserts the lease, renews it for the same owner, or takes it over once
     * the previous holder's lease has expired.
     *
     * @return 1 if {@code owner} now holds the lease, 0 otherwise
     */
    @Modifying
    @Query(value = """
        INSERT INTO rotation_leases (job_id, owner, expires_at)
        VALUES (:jobId, :owner, :expiresAt)
        ON CONFLICT (job_id) DO UPDATE
           SET owner = EXCLUDED.owner, expires_at = EXCLUDED.expires_at
         WHERE rotation_leases.owner = EXCLUDED.owner
            OR rotation_leases.expires_at <= :now
        """, nativeQuery = true)
    int upsertLease(
        @Param("jobId") UUID jobId,
        @Param("owner") String owner,
        @Param("expiresAt") Instant expiresAt,
        @Param("now") Instant now);
}
