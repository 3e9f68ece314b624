package com.phiguard.infrastructure.persistence;

import com.phiguard.domain.model.ProtectedField;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for encrypted PHI fields.
 */
@Repository
public interface SpringDataProtectedFieldRepository extends JpaRepository<ProtectedField, Long> {

    List<ProtectedField> findAllByOrderByIdAsc(Pageable page);

    List<ProtectedField> findByIdGreaterThanOrderByIdAsc(Long cursor, Pageable page);

    Optional<ProtectedField> findByResourceTypeAndResourceIdAndFieldName(
        String resourceType, String resourceId, String fieldName);

    /**
     * Scalar read that bypasses any entity already in the persistence context.
     */
    @Query("SELECT f.ciphertext FROM ProtectedField f WHERE f.id = :id")
    Optional<String> findCiphertextById(@Param("id") Long id);

    /**
     * Compare-and-set on the stored ciphertext.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ProtectedField f
           SET f.ciphertext = :replacement, f.keyVersion = :keyVersion, f.updatedAt = :now
         WHERE f.id = :id AND f.ciphertext = :expected
        """)
    int compareAndSetCiphertext(
        @Param("id") Long id,
        @Param("expected") String expected,
        @Param("replacement") String replacement,
        @Param("keyVersion") String keyVersion,
        @Param("now") Instant now);

    long countByKeyVersion(String keyVersion);
}
