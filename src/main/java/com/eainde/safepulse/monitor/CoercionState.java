package com.eainde.safepulse.monitor;

import com.eainde.safepulse.confidence.CoercionLevel;
import com.eainde.safepulse.confidence.ConfidenceState;
import com.eainde.safepulse.signal.CoercionSignalKind;

/**
 * Coercion view: the derived confidence plus the sticky silent-mode latch, which is
 * deliberately kept outside the score function.
 */
public record CoercionState(
        ConfidenceState<CoercionSignalKind, CoercionLevel> confidence,
        boolean silentMode,
        boolean outwardlyActive
) {
    public boolean isDetected() {
        return confidence.isElevated();
    }

    public CoercionLevel level() {
        return confidence.level();
    }

    public int score() {
        return confidence.score();
    }
}
