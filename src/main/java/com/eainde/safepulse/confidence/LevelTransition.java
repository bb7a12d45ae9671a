package com.eainde.safepulse.confidence;

import com.eainde.safepulse.signal.SafetyDomain;

import java.time.Instant;

/** One boundary crossing of an escalation state machine, up or down. */
public record LevelTransition<L extends Enum<L> & EscalationLevel>(
        SafetyDomain domain,
        L from,
        L to,
        int score,
        Instant at
) {
    public boolean isEscalation() {
        return to.ordinal() > from.ordinal();
    }

    /** Entry into the domain's highest level from any lower level. */
    public boolean entersHighest() {
        return to == EscalationLevels.highest(to.getDeclaringClass()) && from != to;
    }
}
