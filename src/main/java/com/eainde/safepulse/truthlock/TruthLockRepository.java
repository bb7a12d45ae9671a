package com.eainde.safepulse.truthlock;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Persists lock metadata so unreleased locks survive a restart. */
public interface TruthLockRepository {

    void save(LockRecord record);

    void markReleased(String lockId, ReleaseOutcome outcome, Instant releasedAt);

    Optional<LockRecord> findById(String lockId);

    List<LockRecord> findUnreleased();
}
