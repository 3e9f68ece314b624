package com.phiguard.domain.repository;

import com.phiguard.domain.model.FieldRef;
import com.phiguard.domain.model.ProtectedField;

import java.util.List;
import java.util.Optional;

/**
 * Repository for encrypted PHI fields.
 *
 * <p>Implementations must provide:
 * <ul>
 *   <li>A stable ascending order by primary key for {@link #findBatchAfter}</li>
 *   <li>An atomic compare-and-set for {@link #replaceIfUnchanged}</li>
 * </ul>
 *
 * <p>Only serialized ciphertext crosses this boundary, never plaintext.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface ProtectedFieldRepository {

    /**
     * Next rows after {@code cursor} in ascending id order.
     *
     * @param cursor last processed id, or {@code null} for the start of the dataset
     * @param limit maximum rows to return
     * @return up to {@code limit} rows
     */
    List<ProtectedField> findBatchAfter(Long cursor, int limit);

    Optional<ProtectedField> findById(Long id);

    Optional<ProtectedField> findByRef(FieldRef ref);

    /**
     * Current stored ciphertext of a row, read fresh from storage.
     */
    Optional<String> findCiphertext(Long id);

    /**
     * Writes {@code replacement} only if the row still holds {@code expected}.
     *
     * @return true if the row was updated
     */
    boolean replaceIfUnchanged(Long id, String expected, String replacement);

    /**
     * Inserts or overwrites the field identified by {@code ref}.
     */
    ProtectedField upsert(FieldRef ref, String ciphertext);

    long count();

    long countByKeyVersion(String keyVersion);
}
