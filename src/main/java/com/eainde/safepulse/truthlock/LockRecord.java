package com.eainde.safepulse.truthlock;

import java.time.Instant;

/**
 * Persisted lock metadata. Evidence payloads are not part of the record; a lock restored
 * after a restart carries only its deadline and the evidence hash taken at lock time.
 *
 * @param outcome    null while unreleased
 * @param releasedAt null while unreleased
 */
public record LockRecord(String lockId,
                         String incidentId,
                         Instant lockedAt,
                         Instant unlockDeadline,
                         int autoReleaseHours,
                         String evidenceHash,
                         boolean released,
                         Instant releasedAt,
                         ReleaseOutcome outcome) {

    public LockRecord withRelease(ReleaseOutcome outcome, Instant releasedAt) {
        return new LockRecord(lockId, incidentId, lockedAt, unlockDeadline, autoReleaseHours,
                evidenceHash, true, releasedAt, outcome);
    }
}
