package com.eainde.safepulse.truthlock;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTruthLockRepository implements TruthLockRepository {

    private final Map<String, LockRecord> storage = new ConcurrentHashMap<>();

    @Override
    public void save(LockRecord record) {
        storage.put(record.lockId(), record);
    }

    @Override
    public void markReleased(String lockId, ReleaseOutcome outcome, Instant releasedAt) {
        storage.computeIfPresent(lockId, (id, record) -> record.withRelease(outcome, releasedAt));
    }

    @Override
    public Optional<LockRecord> findById(String lockId) {
        return Optional.ofNullable(storage.get(lockId));
    }

    @Override
    public List<LockRecord> findUnreleased() {
        return storage.values().stream()
                .filter(record -> !record.released())
                .sorted(Comparator.comparing(LockRecord::lockedAt))
                .toList();
    }
}
