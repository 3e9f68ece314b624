package com.phiguard.application;

import com.phiguard.config.PerformanceConfiguration.RotationMetrics;
import com.phiguard.config.PhiGuardProperties;
import com.phiguard.domain.model.EncryptedValue;
import com.phiguard.domain.model.ProtectedField;
import com.phiguard.domain.model.RotationCheckpoint.BatchCounters;
import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStateException;
import com.phiguard.domain.model.RotationStatus;
import com.phiguard.domain.repository.ProtectedFieldRepository;
import com.phiguard.domain.repository.RotationJobRepository;
import com.phiguard.domain.repository.RotationLeaseRepository;
import com.phiguard.infrastructure.audit.AuditEventType;
import com.phiguard.infrastructure.audit.RotationAuditEvent;
import com.phiguard.infrastructure.audit.RotationAuditPublisher;
import com.phiguard.infrastructure.crypto.DecryptionFailedException;
import com.phiguard.infrastructure.crypto.FieldEncryptionService;
import com.phiguard.infrastructure.crypto.KeyNotFoundException;
import com.phiguard.infrastructure.keys.KeyRegistry;
import com.phiguard.infrastructure.keys.KeySupply;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Rotation Orchestrator.
 *
 * <p>Moves every protected field from the previous write key to a new one while the system
 * keeps serving reads and writes. Work is driven one batch at a time through {@link #step};
 * the job row holds the checkpoint, so any scheduler can host the loop and a crashed worker
 * resumes exactly where the last committed batch ended.
 *
 * <p><strong>Concurrency:</strong>
 * <ul>
 *   <li>A TTL lease in the database gives one instance the right to advance a job</li>
 *   <li>An in-process lock keeps control operations (pause, rollback, ...) between batches</li>
 *   <li>Every row write is a compare-and-set on the ciphertext read at batch start, so a
 *       concurrent application write always wins</li>
 *   <li>The job's optimistic version rejects a checkpoint written over a concurrent change</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class RotationOrchestrator {

    private final RotationJobRepository jobRepository;
    private final ProtectedFieldRepository fieldRepository;
    private final RotationLeaseRepository leaseRepository;
    private final KeyRegistry keyRegistry;
    private final KeySupply keySupply;
    private final FieldEncryptionService fieldEncryption;
    private final RotationAuditPublisher auditPublisher;
    private final RotationMetrics metrics;
    private final Executor rowExecutor;
    private final Clock clock;
    private final PhiGuardProperties.Rotation settings;
    private final String instanceId;

    private final ConcurrentMap<UUID, ReentrantLock> jobLocks = new ConcurrentHashMap<>();

    public RotationOrchestrator(
            RotationJobRepository jobRepository,
            ProtectedFieldRepository fieldRepository,
            RotationLeaseRepository leaseRepository,
            KeyRegistry keyRegistry,
            KeySupply keySupply,
            FieldEncryptionService fieldEncryption,
            RotationAuditPublisher auditPublisher,
            RotationMetrics metrics,
            @Qualifier("rotationWorkerExecutor") Executor rowExecutor,
            Clock clock,
            PhiGuardProperties properties) {

        this.jobRepository = jobRepository;
        this.fieldRepository = fieldRepository;
        this.leaseRepository = leaseRepository;
        this.keyRegistry = keyRegistry;
        this.keySupply = keySupply;
        this.fieldEncryption = fieldEncryption;
        this.auditPublisher = auditPublisher;
        this.metrics = metrics;
        this.rowExecutor = rowExecutor;
        this.clock = clock;
        this.settings = properties.getRotation();
        this.instanceId = settings.getInstanceId() == null || settings.getInstanceId().isBlank()
            ? "phiguard-" + UUID.randomUUID()
            : settings.getInstanceId();
    }

    /**
     * Starts a rotation to {@code newVersion} (next label when null).
     *
     * <p>The new key is fetched from the key supply, validated, registered and promoted to
     * write-current before the job exists, so every write from now on already uses it.
     *
     * @throws RotationStateException if another job is active or the version is not newer
     * @throws KeyNotFoundException if the key supply has no such version
     * @throws com.phiguard.infrastructure.crypto.KeyConfigurationException if the key is weak
     */
    public synchronized RotationJob start(String newVersion, boolean abortOnFirstFailure, String requestedBy) {
        List<RotationJob> active = jobRepository.findByStatusIn(RotationStatus.active());
        if (!active.isEmpty()) {
            RotationJob running = active.get(0);
            throw new RotationStateException(
                "Rotation job " + running.getId() + " is still " + running.getStatus());
        }

        String source = keyRegistry.currentWriteLabel();
        if (source == null) {
            throw new KeyNotFoundException("(none)", "no write-current key version");
        }
        String target = newVersion == null || newVersion.isBlank()
            ? keyRegistry.nextVersionLabel()
            : newVersion.trim();
        if (!EncryptedValue.isValidLabel(target)) {
            throw new IllegalArgumentException("Key version label must match v<digits>: " + target);
        }
        if (EncryptedValue.versionNumber(target) <= EncryptedValue.versionNumber(source)) {
            throw new RotationStateException("Key " + target + " is not newer than write-current " + source);
        }

        byte[] keyBytes = keySupply.getKey(target)
            .orElseThrow(() -> new KeyNotFoundException(target, "not present in the key supply"));
        keyRegistry.register(target, keyBytes);
        keyRegistry.setCurrentWrite(target);

        Instant now = clock.instant();
        RotationJob job;
        try {
            job = jobRepository.save(RotationJob.create(
                UUID.randomUUID(), source, target, fieldRepository.count(), abortOnFirstFailure, requestedBy, now));
        } catch (RuntimeException e) {
            keyRegistry.reinstate(source);
            throw e;
        }

        log.info("Rotation job {} started: {} -> {}, {} rows, abortOnFirstFailure={}, requestedBy={}",
            job.getId(), source, target, job.getTotalRows(), abortOnFirstFailure, requestedBy);
        metrics.recordTransition(RotationStatus.PENDING);
        auditPublisher.publish(RotationAuditEvent.of(job, AuditEventType.STARTED, null, now));
        return job;
    }

    /**
     * Processes the next batch after the job's cursor.
     *
     * @param batchSize maximum rows in this batch
     * @return counters of this batch and the job state after it
     * @throws LeaseConflictException if another worker owns the job; nothing was changed
     * @throws RotationStateException if the job is not PENDING or RUNNING
     */
    public BatchResult step(UUID jobId, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive");
        }

        ReentrantLock lock = lockFor(jobId);
        if (!lock.tryLock()) {
            throw new LeaseConflictException(jobId, "a step is already running in this instance");
        }
        try {
            RotationJob job = loadLocked(jobId, lock);
            if (!job.getStatus().isSteppable()) {
                forgetIfTerminal(jobId, lock, job.getStatus());
                throw new RotationStateException("Job " + jobId + " is " + job.getStatus() + " and cannot be stepped");
            }

            Instant now = clock.instant();
            if (!leaseRepository.tryAcquire(jobId, instanceId, now.plus(settings.getLeaseTtl()), now)) {
                throw new LeaseConflictException(jobId, "lease held by another instance");
            }

            if (job.getStatus() == RotationStatus.PENDING) {
                job.markRunning(now);
                job = saveJob(job);
                metrics.recordTransition(RotationStatus.RUNNING);
            }

            List<ProtectedField> batch = fieldRepository.findBatchAfter(job.getCheckpoint().getCursor(), batchSize);
            if (batch.isEmpty() && job.isExhausted()) {
                // Nothing new past the cursor; the job only waits for complete()
                log.debug("Rotation job {} is exhausted at cursor {}, nothing to commit",
                    jobId, job.getCheckpoint().getCursor());
                return BatchResult.of(job, BatchCounters.EMPTY, Collections.emptyList());
            }

            BatchResult result = job.isAbortOnFirstFailure()
                ? migrateStrict(job, batch, batchSize)
                : migrateParallel(job, batch, batchSize);
            forgetIfTerminal(jobId, lock, result.status());
            return result;

        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the job completed once the whole dataset was scanned.
     *
     * @param acceptPartial accept rows still under the source version or failed rows
     * @throws RotationStateException if the cursor is not exhausted, or rows remain without
     *         {@code acceptPartial}
     */
    public RotationJob complete(UUID jobId, boolean acceptPartial) {
        return underLock(jobId, job -> {
            Instant now = clock.instant();
            long remaining = fieldRepository.countByKeyVersion(job.getSourceVersion());
            job.complete(remaining, acceptPartial, now);
            RotationJob saved = saveJob(job);
            leaseRepository.release(jobId);

            log.info("Rotation job {} completed: migrated={}, failed={}, remaining under {}={}, partial={}",
                jobId, saved.getCheckpoint().getMigrated(), saved.getCheckpoint().getFailed(),
                saved.getSourceVersion(), remaining, saved.isAcceptedPartial());
            metrics.recordTransition(RotationStatus.COMPLETED);
            auditPublisher.publish(RotationAuditEvent.of(saved, AuditEventType.COMPLETED,
                saved.isAcceptedPartial() ? "accepted partial: " + remaining + " rows remaining" : null, now));
            return saved;
        });
    }

    public RotationJob pause(UUID jobId) {
        return underLock(jobId, job -> {
            Instant now = clock.instant();
            job.pause(now);
            RotationJob saved = saveJob(job);
            leaseRepository.release(jobId);

            log.info("Rotation job {} paused at cursor {}", jobId, saved.getCheckpoint().getCursor());
            metrics.recordTransition(RotationStatus.PAUSED);
            auditPublisher.publish(RotationAuditEvent.of(saved, AuditEventType.PAUSED, null, now));
            return saved;
        });
    }

    public RotationJob resume(UUID jobId) {
        return underLock(jobId, job -> {
            Instant now = clock.instant();
            job.resume(now);
            RotationJob saved = saveJob(job);

            log.info("Rotation job {} resumed from cursor {}", jobId, saved.getCheckpoint().getCursor());
            metrics.recordTransition(RotationStatus.RUNNING);
            auditPublisher.publish(RotationAuditEvent.of(saved, AuditEventType.RESUMED, null, now));
            return saved;
        });
    }

    /**
     * Stops the job and makes its source key write-current again.
     *
     * <p>Rows already migrated stay under the target version, which remains READ_ONLY so
     * they keep decrypting.
     */
    public RotationJob rollback(UUID jobId, String reason) {
        return underLock(jobId, job -> {
            Instant now = clock.instant();
            // Fails fast if the source key is gone, before the job changes
            keyRegistry.resolveForDecrypt(job.getSourceVersion());

            job.rollBack(reason == null ? "rolled back by operator" : reason, now);
            RotationJob saved = saveJob(job);
            keyRegistry.reinstate(saved.getSourceVersion());
            leaseRepository.release(jobId);

            log.warn("Rotation job {} rolled back: {} is write-current again, {} rows stay under {}",
                jobId, saved.getSourceVersion(), saved.getCheckpoint().getMigrated(), saved.getTargetVersion());
            metrics.recordTransition(RotationStatus.ROLLED_BACK);
            auditPublisher.publish(RotationAuditEvent.of(saved, AuditEventType.ROLLED_BACK, saved.getLastError(), now));
            return saved;
        });
    }

    public RotationJob abort(UUID jobId) {
        return rollback(jobId, "aborted by operator");
    }

    public RotationJob status(UUID jobId) {
        return load(jobId);
    }

    public List<RotationJob> list() {
        return jobRepository.findAllNewestFirst();
    }

    public List<RotationJob> activeJobs() {
        return jobRepository.findByStatusIn(RotationStatus.active());
    }

    public String getInstanceId() {
        return instanceId;
    }

    private BatchResult migrateParallel(RotationJob job, List<ProtectedField> batch, int batchSize) {
        String target = job.getTargetVersion();

        List<CompletableFuture<RowOutcome>> futures = new ArrayList<>(batch.size());
        for (ProtectedField row : batch) {
            futures.add(CompletableFuture.supplyAsync(() -> migrateRowRecordingFailure(target, row), rowExecutor));
        }

        // Barrier: the checkpoint never covers a row that is still in flight
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.error("Rotation job {} batch after cursor {} aborted, checkpoint unchanged",
                job.getId(), job.getCheckpoint().getCursor());
            throw unwrap(e);
        }

        long migrated = 0;
        long skipped = 0;
        List<Long> failedRows = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            RowOutcome outcome = futures.get(i).join();
            switch (outcome) {
                case MIGRATED -> migrated++;
                case SKIPPED -> skipped++;
                case FAILED -> failedRows.add(batch.get(i).getId());
            }
        }

        BatchCounters counters = new BatchCounters(batch.size(), migrated, skipped, failedRows.size());
        Long lastRowId = batch.isEmpty() ? null : batch.get(batch.size() - 1).getId();
        return commit(job, lastRowId, counters, batch.size() < batchSize, failedRows);
    }

    private BatchResult migrateStrict(RotationJob job, List<ProtectedField> batch, int batchSize) {
        String target = job.getTargetVersion();
        long migrated = 0;
        long skipped = 0;

        for (int i = 0; i < batch.size(); i++) {
            ProtectedField row = batch.get(i);
            try {
                if (migrateRow(target, row) == RowOutcome.MIGRATED) {
                    migrated++;
                } else {
                    skipped++;
                }
            } catch (RotationRowException e) {
                log.error("Rotation job {} stopped at row {}: {}", job.getId(), e.getRowId(), e.getCause().getClass().getSimpleName());
                BatchCounters counters = new BatchCounters(i + 1, migrated, skipped, 1);
                Instant now = clock.instant();
                job.commitBatch(row.getId(), counters, false, now);
                job.fail(e.getMessage(), now);
                RotationJob saved = saveJob(job);
                leaseRepository.release(job.getId());

                metrics.recordBatch(target, migrated, skipped, 1);
                metrics.recordTransition(RotationStatus.FAILED);
                auditPublisher.publish(RotationAuditEvent.of(saved, AuditEventType.FAILED, saved.getLastError(), now));
                return BatchResult.of(saved, counters, List.of(row.getId()));
            }
        }

        BatchCounters counters = new BatchCounters(batch.size(), migrated, skipped, 0);
        Long lastRowId = batch.isEmpty() ? null : batch.get(batch.size() - 1).getId();
        return commit(job, lastRowId, counters, batch.size() < batchSize, Collections.emptyList());
    }

    private BatchResult commit(RotationJob job, Long lastRowId, BatchCounters counters,
                               boolean batchWasShort, List<Long> failedRows) {
        Instant now = clock.instant();
        if (!failedRows.isEmpty()) {
            job.recordError(failedRows.size() + " rows failed in batch, first row id " + failedRows.get(0), now);
        }
        job.commitBatch(lastRowId, counters, batchWasShort, now);
        RotationJob saved = saveJob(job);

        log.info("Rotation job {} batch committed: cursor={}, scanned={}, migrated={}, skipped={}, failed={}, exhausted={}",
            saved.getId(), saved.getCheckpoint().getCursor(), counters.scanned(), counters.migrated(),
            counters.skipped(), counters.failed(), saved.isExhausted());
        metrics.recordBatch(saved.getTargetVersion(), counters.migrated(), counters.skipped(), counters.failed());
        auditPublisher.publish(RotationAuditEvent.of(saved, AuditEventType.BATCH_COMPLETED, null, now));
        return BatchResult.of(saved, counters, failedRows);
    }

    private RowOutcome migrateRowRecordingFailure(String target, ProtectedField row) {
        try {
            return migrateRow(target, row);
        } catch (RotationRowException e) {
            log.warn("Row {} not migrated to {}: {}", e.getRowId(), target, e.getCause().getClass().getSimpleName());
            return RowOutcome.FAILED;
        }
    }

    /**
     * Re-encrypts one row under {@code target}.
     *
     * @throws RotationRowException if the stored value cannot be decrypted
     */
    private RowOutcome migrateRow(String target, ProtectedField row) {
        String original = row.getCiphertext();
        if (target.equals(row.getKeyVersion())) {
            return RowOutcome.SKIPPED;
        }

        String plaintext;
        try {
            plaintext = fieldEncryption.decryptOnRead(original);
        } catch (DecryptionFailedException e) {
            throw new RotationRowException(row.getId(), e);
        }

        Optional<String> current = fieldRepository.findCiphertext(row.getId());
        if (current.isEmpty() || !current.get().equals(original)) {
            log.debug("Row {} changed since batch read, skipped", row.getId());
            return RowOutcome.SKIPPED;
        }

        String rewritten = fieldEncryption.encryptUnder(target, plaintext);
        if (!fieldRepository.replaceIfUnchanged(row.getId(), original, rewritten)) {
            log.debug("Row {} written concurrently, skipped", row.getId());
            return RowOutcome.SKIPPED;
        }
        return RowOutcome.MIGRATED;
    }

    private RotationJob underLock(UUID jobId, Function<RotationJob, RotationJob> action) {
        ReentrantLock lock = lockFor(jobId);
        try {
            if (!lock.tryLock(settings.getLeaseTtl().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LeaseConflictException(jobId, "a step did not finish within the lease period");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LeaseConflictException(jobId, "interrupted while waiting for the running step");
        }
        try {
            RotationJob result = action.apply(loadLocked(jobId, lock));
            forgetIfTerminal(jobId, lock, result.getStatus());
            return result;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(UUID jobId) {
        return jobLocks.computeIfAbsent(jobId, id -> new ReentrantLock());
    }

    /**
     * Loads the job while holding its lock; an unknown id does not keep a lock entry.
     */
    private RotationJob loadLocked(UUID jobId, ReentrantLock lock) {
        try {
            return load(jobId);
        } catch (RotationJobNotFoundException e) {
            jobLocks.remove(jobId, lock);
            throw e;
        }
    }

    /**
     * Terminal jobs accept no further operation, so their lock can go.
     */
    private void forgetIfTerminal(UUID jobId, ReentrantLock lock, RotationStatus status) {
        if (status.isTerminal()) {
            jobLocks.remove(jobId, lock);
        }
    }

    int trackedLockCount() {
        return jobLocks.size();
    }

    private RotationJob load(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new RotationJobNotFoundException(jobId));
    }

    private RotationJob saveJob(RotationJob job) {
        try {
            return jobRepository.save(job);
        } catch (OptimisticLockingFailureException e) {
            throw new RotationStateException("Job " + job.getId() + " was changed concurrently, reload and retry");
        }
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return e;
    }

    private enum RowOutcome {
        MIGRATED,
        SKIPPED,
        FAILED
    }
}
