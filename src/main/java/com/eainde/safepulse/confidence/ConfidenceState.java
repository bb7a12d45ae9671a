package com.eainde.safepulse.confidence;

import com.eainde.safepulse.signal.SafetyDomain;
import com.eainde.safepulse.signal.Signal;
import com.eainde.safepulse.signal.SignalKind;

import java.time.Instant;
import java.util.List;

/**
 * Derived view of a domain at one instant. Recomputed from the history on every
 * insertion or poll, never stored as ground truth.
 */
public record ConfidenceState<K extends Enum<K> & SignalKind, L extends Enum<L> & EscalationLevel>(
        SafetyDomain domain,
        int score,
        L level,
        List<Signal<K>> signals,
        Instant evaluatedAt
) {
    public ConfidenceState {
        signals = List.copyOf(signals);
    }

    /** True when the level is above the domain's lowest level. */
    public boolean isElevated() {
        return level.ordinal() > 0;
    }
}
