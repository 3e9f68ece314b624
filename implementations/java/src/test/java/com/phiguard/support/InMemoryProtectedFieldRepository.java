package com.phiguard.support;

import com.phiguard.domain.model.EncryptedValue;
import com.phiguard.domain.model.FieldRef;
import com.phiguard.domain.model.ProtectedField;
import com.phiguard.domain.repository.ProtectedFieldRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Field store with database-like snapshot reads: every read returns a fresh entity copy.
 *
 * <p>Counts successful compare-and-set writes per row so tests can check exactly-once
 * migration, and offers a hook that runs right before each compare-and-set.
 */
public class InMemoryProtectedFieldRepository implements ProtectedFieldRepository {

    private final ConcurrentSkipListMap<Long, StoredRow> rows = new ConcurrentSkipListMap<>();
    private final Map<Long, AtomicInteger> casWrites = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;

    private volatile Consumer<Long> beforeCompareAndSet = id -> { };

    public InMemoryProtectedFieldRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<ProtectedField> findBatchAfter(Long cursor, int limit) {
        Map<Long, StoredRow> tail = cursor == null ? rows : rows.tailMap(cursor, false);
        return tail.entrySet().stream()
            .limit(limit)
            .map(entry -> entry.getValue().toEntity(entry.getKey()))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<ProtectedField> findById(Long id) {
        return Optional.ofNullable(rows.get(id)).map(row -> row.toEntity(id));
    }

    @Override
    public Optional<ProtectedField> findByRef(FieldRef ref) {
        return rows.entrySet().stream()
            .filter(entry -> entry.getValue().ref().equals(ref))
            .findFirst()
            .map(entry -> entry.getValue().toEntity(entry.getKey()));
    }

    @Override
    public Optional<String> findCiphertext(Long id) {
        return Optional.ofNullable(rows.get(id)).map(StoredRow::ciphertext);
    }

    @Override
    public boolean replaceIfUnchanged(Long id, String expected, String replacement) {
        beforeCompareAndSet.accept(id);
        EncryptedValue.versionOf(replacement);
        boolean[] replaced = new boolean[1];
        rows.computeIfPresent(id, (key, row) -> {
            if (!row.ciphertext().equals(expected)) {
                return row;
            }
            replaced[0] = true;
            return new StoredRow(row.ref(), replacement, clock.instant());
        });
        if (replaced[0]) {
            casWrites.computeIfAbsent(id, key -> new AtomicInteger()).incrementAndGet();
        }
        return replaced[0];
    }

    @Override
    public synchronized ProtectedField upsert(FieldRef ref, String ciphertext) {
        EncryptedValue.versionOf(ciphertext);
        Long id = rows.entrySet().stream()
            .filter(entry -> entry.getValue().ref().equals(ref))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElseGet(ids::incrementAndGet);
        StoredRow row = new StoredRow(ref, ciphertext, clock.instant());
        rows.put(id, row);
        return row.toEntity(id);
    }

    @Override
    public long count() {
        return rows.size();
    }

    @Override
    public long countByKeyVersion(String keyVersion) {
        return rows.values().stream()
            .filter(row -> keyVersion.equals(EncryptedValue.versionOf(row.ciphertext())))
            .count();
    }

    /**
     * Stores a value as-is, bypassing the field adapter, e.g. a tampered ciphertext.
     */
    public synchronized long insertRaw(FieldRef ref, String storedValue) {
        long id = ids.incrementAndGet();
        rows.put(id, new StoredRow(ref, storedValue, clock.instant()));
        return id;
    }

    public void setBeforeCompareAndSet(Consumer<Long> hook) {
        this.beforeCompareAndSet = hook;
    }

    public int compareAndSetWrites(Long id) {
        AtomicInteger count = casWrites.get(id);
        return count == null ? 0 : count.get();
    }

    public List<Long> ids() {
        return List.copyOf(rows.keySet());
    }

    private record StoredRow(FieldRef ref, String ciphertext, Instant updatedAt) {

        ProtectedField toEntity(Long id) {
            return new ProtectedField(id, ref.resourceType(), ref.resourceId(), ref.fieldName(), ciphertext, updatedAt);
        }
    }
}
