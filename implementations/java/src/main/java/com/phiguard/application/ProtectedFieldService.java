package com.phiguard.application;

import com.phiguard.domain.model.FieldRef;
import com.phiguard.domain.model.ProtectedField;
import com.phiguard.domain.repository.ProtectedFieldRepository;
import com.phiguard.infrastructure.crypto.FieldEncryptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Application write and read path for encrypted fields.
 *
 * <p>Writes always use the write-current key; reads use whatever key the stored value names,
 * so both keep working while a rotation is in progress.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProtectedFieldService {

    private final ProtectedFieldRepository fieldRepository;
    private final FieldEncryptionService fieldEncryption;

    public ProtectedField write(FieldRef ref, String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Protected field value must not be null");
        }
        ProtectedField saved = fieldRepository.upsert(ref, fieldEncryption.encryptOnWrite(plaintext));
        log.debug("Wrote protected field {} under {}", ref, saved.getKeyVersion());
        return saved;
    }

    /**
     * @throws com.phiguard.infrastructure.crypto.DecryptionFailedException if the stored value
     *         cannot be decrypted
     */
    public Optional<String> read(FieldRef ref) {
        return fieldRepository.findByRef(ref)
            .map(field -> fieldEncryption.decryptOnRead(field.getCiphertext()));
    }

    public Optional<String> versionOf(FieldRef ref) {
        return fieldRepository.findByRef(ref).map(ProtectedField::getKeyVersion);
    }
}
