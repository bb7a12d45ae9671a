package com.eainde.safepulse.truthlock;

import java.time.Instant;

/** Point-in-time view of a vault; {@code timeRemaining} is derived from the deadline at {@code asOf}. */
public record TruthLockStatus(String incidentId,
                              String lockId,
                              TruthLockPhase phase,
                              boolean canCancel,
                              Instant unlockDeadline,
                              String timeRemaining,
                              int evidenceCount,
                              Instant asOf) {

    public boolean isLocked() {
        return phase.isLocked();
    }
}
