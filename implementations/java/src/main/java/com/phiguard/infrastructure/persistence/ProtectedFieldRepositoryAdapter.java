package com.phiguard.infrastructure.persistence;

import com.phiguard.domain.model.EncryptedValue;
import com.phiguard.domain.model.FieldRef;
import com.phiguard.domain.model.ProtectedField;
import com.phiguard.domain.repository.ProtectedFieldRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing the domain field repository with Spring Data JPA.
 *
 * <p>Every method runs in its own transaction, so a rotation batch commits row by row and the
 * job checkpoint is the only cross-row barrier.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ProtectedFieldRepositoryAdapter implements ProtectedFieldRepository {

    private final SpringDataProtectedFieldRepository springDataRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<ProtectedField> findBatchAfter(Long cursor, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        return cursor == null
            ? springDataRepository.findAllByOrderByIdAsc(page)
            : springDataRepository.findByIdGreaterThanOrderByIdAsc(cursor, page);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ProtectedField> findById(Long id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ProtectedField> findByRef(FieldRef ref) {
        return springDataRepository.findByResourceTypeAndResourceIdAndFieldName(
            ref.resourceType(), ref.resourceId(), ref.fieldName());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findCiphertext(Long id) {
        return springDataRepository.findCiphertextById(id);
    }

    @Override
    public boolean replaceIfUnchanged(Long id, String expected, String replacement) {
        int updated = springDataRepository.compareAndSetCiphertext(
            id, expected, replacement, EncryptedValue.versionOf(replacement), clock.instant());
        if (updated == 0) {
            log.debug("Compare-and-set lost for field id={}", id);
        }
        return updated == 1;
    }

    @Override
    public ProtectedField upsert(FieldRef ref, String ciphertext) {
        ProtectedField field = findByRef(ref)
            .map(existing -> {
                existing.replaceCiphertext(ciphertext, clock.instant());
                return existing;
            })
            .orElseGet(() -> ProtectedField.create(
                ref.resourceType(), ref.resourceId(), ref.fieldName(), ciphertext, clock.instant()));

        ProtectedField saved = springDataRepository.save(field);
        log.debug("Field persisted: id={}, keyVersion={}", saved.getId(), saved.getKeyVersion());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return springDataRepository.count();
    }

    @Override
    @Transactional(readOnly = true)
    public long countByKeyVersion(String keyVersion) {
        return springDataRepository.countByKeyVersion(keyVersion);
    }
}
