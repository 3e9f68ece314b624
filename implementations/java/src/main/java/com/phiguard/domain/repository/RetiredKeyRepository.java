package com.phiguard.domain.repository;

import com.phiguard.domain.model.RetiredKey;

import java.util.Set;

/**
 * Store of retired key labels.
 */
public interface RetiredKeyRepository {

    /**
     * Records the retirement. Saving an already retired label keeps the first record.
     */
    RetiredKey save(RetiredKey retiredKey);

    Set<String> findAllLabels();
}
