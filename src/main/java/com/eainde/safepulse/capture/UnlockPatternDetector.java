package com.eainde.safepulse.capture;

import com.eainde.safepulse.signal.CoercionSignalKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Flags rapid consecutive unlocks. An unlock less than {@link #RAPID_INTERVAL} after the
 * previous one counts up, a slower one counts down; the third rapid unlock emits
 * {@code forced_unlock} and starts the count over.
 */
public class UnlockPatternDetector {

    static final Duration RAPID_INTERVAL = Duration.ofSeconds(5);
    static final int RAPID_UNLOCKS = 3;
    static final double FORCED_UNLOCK_VALUE = 45;

    private Instant lastUnlock;
    private int rapidCount;

    public synchronized Optional<DetectedSignal<CoercionSignalKind>> recordUnlock(Instant at) {
        Optional<DetectedSignal<CoercionSignalKind>> result = Optional.empty();
        if (lastUnlock != null && Duration.between(lastUnlock, at).compareTo(RAPID_INTERVAL) < 0) {
            rapidCount++;
            if (rapidCount >= RAPID_UNLOCKS) {
                result = Optional.of(new DetectedSignal<>(CoercionSignalKind.FORCED_UNLOCK, FORCED_UNLOCK_VALUE,
                        "Rapid consecutive unlocks"));
                rapidCount = 0;
            }
        } else {
            rapidCount = Math.max(0, rapidCount - 1);
        }
        lastUnlock = at;
        return result;
    }

    public synchronized void reset() {
        lastUnlock = null;
        rapidCount = 0;
    }
}
