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

/**
 * Durable record of a retired key version.
 *
 * <p>The key supply may still hold the material after retirement; this row is what keeps the
 * label RETIRED across restarts.
 */
@Entity
@Table(name = "retired_keys")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor
public class RetiredKey {

    @Id
    @Column(name = "label", nullable = false, updatable = false, length = 16)
    private String label;

    @Column(name = "retired_by", length = 128)
    private String retiredBy;

    @Column(name = "retired_at", nullable = false, updatable = false)
    private Instant retiredAt;
}
