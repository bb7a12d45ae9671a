package com.eainde.safepulse.alert;

import com.eainde.safepulse.confidence.ConfidenceState;
import com.eainde.safepulse.signal.SafetyDomain;

import java.time.Instant;
import java.util.List;

/**
 * Payload handed to the alerting collaborator on an edge-triggered escalation or an
 * intent confirmation.
 */
public record AlertEvent(
        SafetyDomain domain,
        String level,
        int score,
        List<SignalSnapshot> signals,
        Instant occurredAt
) {
    public AlertEvent {
        signals = List.copyOf(signals);
    }

    public static AlertEvent of(ConfidenceState<?, ?> state) {
        return new AlertEvent(
                state.domain(),
                state.level().name(),
                state.score(),
                state.signals().stream().map(SignalSnapshot::of).toList(),
                state.evaluatedAt());
    }
}
