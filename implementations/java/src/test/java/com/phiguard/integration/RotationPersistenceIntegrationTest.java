package com.phiguard.integration;

import com.phiguard.application.BatchResult;
import com.phiguard.application.ProtectedFieldService;
import com.phiguard.application.RotationOrchestrator;
import com.phiguard.domain.model.FieldRef;
import com.phiguard.domain.model.ProtectedField;
import com.phiguard.domain.model.RetiredKey;
import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStatus;
import com.phiguard.domain.repository.ProtectedFieldRepository;
import com.phiguard.domain.repository.RetiredKeyRepository;
import com.phiguard.domain.repository.RotationJobRepository;
import com.phiguard.domain.repository.RotationLeaseRepository;
import com.phiguard.infrastructure.crypto.FieldEncryptionService;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Persistence adapters and a full rotation against a real PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RotationPersistenceIntegrationTest {

    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("phiguard")
            .withUsername("phiguard")
            .withPassword("changeme");

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @AfterAll
    void tearDown() {
        postgres.stop();
    }

    @Autowired
    ProtectedFieldRepository fieldRepository;

    @Autowired
    RotationJobRepository jobRepository;

    @Autowired
    RotationLeaseRepository leaseRepository;

    @Autowired
    RetiredKeyRepository retiredKeyRepository;

    @Autowired
    ProtectedFieldService fieldService;

    @Autowired
    FieldEncryptionService fieldEncryption;

    @Autowired
    RotationOrchestrator orchestrator;

    private FieldRef ref(String field) {
        return new FieldRef("integration", UUID.randomUUID().toString(), field);
    }

    @Test
    void compare_and_set_only_replaces_the_expected_ciphertext() {
        FieldRef ref = ref("ssn");
        ProtectedField stored = fieldService.write(ref, "123-45-6789");
        String original = stored.getCiphertext();
        String replacement = fieldEncryption.encryptUnder("v2", "123-45-6789");

        assertTrue(fieldRepository.replaceIfUnchanged(stored.getId(), original, replacement));
        assertFalse(fieldRepository.replaceIfUnchanged(stored.getId(), original,
            fieldEncryption.encryptUnder("v2", "000-00-0000")));

        ProtectedField reloaded = fieldRepository.findById(stored.getId()).orElseThrow();
        assertEquals(replacement, reloaded.getCiphertext());
        assertEquals("v2", reloaded.getKeyVersion());
        assertEquals("123-45-6789", fieldService.read(ref).orElseThrow());
    }

    @Test
    void batches_are_read_in_ascending_id_order_after_the_cursor() {
        Long first = fieldService.write(ref("a"), "a").getId();
        Long second = fieldService.write(ref("b"), "b").getId();
        Long third = fieldService.write(ref("c"), "c").getId();

        List<ProtectedField> batch = fieldRepository.findBatchAfter(first, 2);

        assertEquals(List.of(second, third), batch.stream().map(ProtectedField::getId).toList());
    }

    @Test
    void upsert_rewrites_an_existing_field() {
        FieldRef ref = ref("phone");
        Long id = fieldService.write(ref, "555-0100").getId();

        ProtectedField updated = fieldService.write(ref, "555-0199");

        assertEquals(id, updated.getId());
        assertEquals("555-0199", fieldService.read(ref).orElseThrow());
    }

    @Test
    void lease_is_exclusive_until_it_expires() {
        UUID jobId = UUID.randomUUID();
        Instant now = Instant.parse("2026-03-01T12:00:00Z");

        assertTrue(leaseRepository.tryAcquire(jobId, "node-a", now.plusSeconds(60), now));
        assertTrue(leaseRepository.tryAcquire(jobId, "node-a", now.plusSeconds(90), now.plusSeconds(30)));
        assertFalse(leaseRepository.tryAcquire(jobId, "node-b", now.plusSeconds(120), now.plusSeconds(60)));
        assertTrue(leaseRepository.tryAcquire(jobId, "node-b", now.plusSeconds(150), now.plusSeconds(90)));

        leaseRepository.release(jobId);
        assertTrue(leaseRepository.tryAcquire(jobId, "node-a", now.plusSeconds(160), now.plusSeconds(100)));
    }

    @Test
    void retirement_record_keeps_the_first_entry() {
        Instant first = Instant.parse("2026-03-02T10:00:00Z");
        retiredKeyRepository.save(new RetiredKey("v41", "alice", first));

        RetiredKey again = retiredKeyRepository.save(new RetiredKey("v41", "bob", first.plusSeconds(60)));

        assertEquals("alice", again.getRetiredBy());
        assertTrue(retiredKeyRepository.findAllLabels().contains("v41"));
    }

    @Test
    void rotation_runs_to_completion_against_postgres() {
        for (int i = 0; i < 5; i++) {
            fieldService.write(ref("email"), "patient" + i + "@example.com");
        }

        RotationJob job = orchestrator.start("v2", false, "integration");
        BatchResult result;
        do {
            result = orchestrator.step(job.getId(), 2);
        } while (!result.exhausted());
        RotationJob completed = orchestrator.complete(job.getId(), false);

        assertEquals(RotationStatus.COMPLETED, completed.getStatus());
        assertEquals(0, fieldRepository.countByKeyVersion("v1"));
        assertEquals(0L, completed.getRemainingSourceRows());
        assertEquals(completed.getId(), jobRepository.findAllNewestFirst().get(0).getId());
        assertTrue(leaseRepository.tryAcquire(job.getId(), "someone-else", Instant.now().plusSeconds(5), Instant.now()));
    }
}
