package com.eainde.safepulse.truthlock;

import java.time.Instant;
import java.util.Objects;

/**
 * One appended piece of evidence. {@code integrityHash} is the SHA-256 of the payload
 * alone, so it can be re-derived from the payload at any time.
 */
public record EvidenceItem(String type, String payload, Instant timestamp, String integrityHash) {

    public EvidenceItem {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(integrityHash, "integrityHash");
    }

    public static EvidenceItem of(String type, String payload, Instant timestamp) {
        return new EvidenceItem(type, payload, timestamp, EvidenceHasher.hash(payload));
    }

    public boolean verify() {
        return integrityHash.equals(EvidenceHasher.hash(payload));
    }
}
