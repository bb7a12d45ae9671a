package com.eainde.safepulse.capture;

import com.eainde.safepulse.signal.SignalKind;

/** A signal proposed by a capture reducer, not yet timestamped by an aggregator. */
public record DetectedSignal<K extends Enum<K> & SignalKind>(
        K kind,
        double value,
        String description
) {
}
