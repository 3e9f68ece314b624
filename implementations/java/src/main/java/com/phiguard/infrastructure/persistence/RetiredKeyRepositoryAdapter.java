package com.phiguard.infrastructure.persistence;

import com.phiguard.domain.model.RetiredKey;
import com.phiguard.domain.repository.RetiredKeyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;
import java.util.TreeSet;

@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class RetiredKeyRepositoryAdapter implements RetiredKeyRepository {

    private final SpringDataRetiredKeyRepository springDataRepository;

    @Override
    public RetiredKey save(RetiredKey retiredKey) {
        return springDataRepository.findById(retiredKey.getLabel())
            .orElseGet(() -> {
                RetiredKey saved = springDataRepository.saveAndFlush(retiredKey);
                log.debug("Retirement of key {} persisted", saved.getLabel());
                return saved;
            });
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> findAllLabels() {
        Set<String> labels = new TreeSet<>();
        springDataRepository.findAll().forEach(key -> labels.add(key.getLabel()));
        return labels;
    }
}
