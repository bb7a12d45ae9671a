package com.eainde.safepulse.truthlock;

import java.time.Instant;
import java.util.List;

/** Emitted once when a lock reaches a terminal state. */
public record ReleaseNotice(String lockId,
                            String incidentId,
                            ReleaseOutcome outcome,
                            Instant releasedAt,
                            String evidenceHash,
                            List<EvidenceItem> evidence) {

    public ReleaseNotice {
        evidence = List.copyOf(evidence);
    }

    public int evidenceCount() {
        return evidence.size();
    }
}
