package com.phiguard.infrastructure.persistence;

import com.phiguard.domain.model.RetiredKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpringDataRetiredKeyRepository extends JpaRepository<RetiredKey, String> {
}
