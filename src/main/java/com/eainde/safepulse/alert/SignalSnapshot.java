package com.eainde.safepulse.alert;

import com.eainde.safepulse.signal.Signal;

import java.time.Instant;

/** Collaborator-facing copy of a signal or intent event, with the kind as its wire name. */
public record SignalSnapshot(
        String kind,
        double value,
        Instant timestamp,
        String description
) {
    public static SignalSnapshot of(Signal<?> signal) {
        return new SignalSnapshot(signal.kind().wireName(), signal.value(), signal.timestamp(), signal.description());
    }
}
