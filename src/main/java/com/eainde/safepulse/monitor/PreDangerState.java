package com.eainde.safepulse.monitor;

import com.eainde.safepulse.confidence.ConfidenceState;
import com.eainde.safepulse.confidence.SituationalLevel;
import com.eainde.safepulse.signal.SituationalSignalKind;

import java.time.Duration;
import java.util.List;

/**
 * Situational-risk view.
 *
 * @param confidence  derived score and level
 * @param triggers    named patterns present in the current history
 * @param timeInState time since the current level was entered
 */
public record PreDangerState(
        ConfidenceState<SituationalSignalKind, SituationalLevel> confidence,
        List<String> triggers,
        Duration timeInState
) {
    public PreDangerState {
        triggers = List.copyOf(triggers);
    }

    public boolean isActive() {
        return confidence.isElevated();
    }

    public SituationalLevel level() {
        return confidence.level();
    }
}
