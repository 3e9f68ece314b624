package com.phiguard.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One encrypted PHI field of some resource (client, appointment, session note, ...).
 *
 * <p>Stores the serialized {@link EncryptedValue} and, denormalized, the key version it was
 * written under so rotation progress can be counted without parsing every row. The ascending
 * {@code id} is the total order the rotation cursor walks.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Entity
@Table(
    name = "protected_fields",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_protected_fields_ref",
        columnNames = {"resource_type", "resource_id", "field_name"}),
    indexes = @Index(name = "ix_protected_fields_key_version", columnList = "key_version")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class ProtectedField {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_type", nullable = false, length = 64)
    private String resourceType;

    @Column(name = "resource_id", nullable = false, length = 64)
    private String resourceId;

    @Column(name = "field_name", nullable = false, length = 64)
    private String fieldName;

    @Column(name = "ciphertext", nullable = false, columnDefinition = "TEXT")
    private String ciphertext;

    @Column(name = "key_version", nullable = false, length = 16)
    private String keyVersion;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ProtectedField(Long id, String resourceType, String resourceId, String fieldName,
                          String ciphertext, Instant updatedAt) {
        this.id = id;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.fieldName = fieldName;
        this.updatedAt = updatedAt;
        replaceCiphertext(ciphertext, updatedAt);
    }

    public static ProtectedField create(String resourceType, String resourceId, String fieldName,
                                        String ciphertext, Instant now) {
        return new ProtectedField(null, resourceType, resourceId, fieldName, ciphertext, now);
    }

    /**
     * Replaces the stored ciphertext; the key version column follows the value's own label.
     */
    public void replaceCiphertext(String serialized, Instant now) {
        this.keyVersion = EncryptedValue.versionOf(serialized);
        this.ciphertext = serialized;
        this.updatedAt = now;
    }

    public FieldRef ref() {
        return new FieldRef(resourceType, resourceId, fieldName);
    }

    @Override
    public String toString() {
        return "ProtectedField[id=" + id + ", ref=" + ref() + ", keyVersion=" + keyVersion + "]";
    }
}
