package com.eainde.safepulse.signal;

import java.time.Instant;
import java.util.Objects;

/**
 * A single timestamped observation fed into a confidence aggregator.
 *
 * @param kind        domain-specific category, carries the scoring weight
 * @param value       caller-supplied magnitude, conventionally 0-100
 * @param timestamp   instant of observation; drives decay
 * @param description provenance for audit and display, never scored
 */
public record Signal<K extends Enum<K> & SignalKind>(
        K kind,
        double value,
        Instant timestamp,
        String description
) {
    public Signal {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        description = description != null ? description : "";
    }
}
