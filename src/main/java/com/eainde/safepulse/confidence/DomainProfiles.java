package com.eainde.safepulse.confidence;

import com.eainde.safepulse.signal.CoercionSignalKind;
import com.eainde.safepulse.signal.DangerSignalKind;
import com.eainde.safepulse.signal.SafetyDomain;
import com.eainde.safepulse.signal.SituationalSignalKind;

import java.time.Duration;

/** The three scoring profiles of the core. */
public final class DomainProfiles {

    public static final ConfidenceProfile<DangerSignalKind, DangerLevel> DANGER = new ConfidenceProfile<>(
            SafetyDomain.DANGER, DangerSignalKind.class, DangerLevel.class,
            Duration.ofMinutes(10), 100.0, 20);

    // Coercion evidence goes stale fastest.
    public static final ConfidenceProfile<CoercionSignalKind, CoercionLevel> COERCION = new ConfidenceProfile<>(
            SafetyDomain.COERCION, CoercionSignalKind.class, CoercionLevel.class,
            Duration.ofMinutes(5), 2.0, 30);

    public static final ConfidenceProfile<SituationalSignalKind, SituationalLevel> SITUATIONAL = new ConfidenceProfile<>(
            SafetyDomain.SITUATIONAL, SituationalSignalKind.class, SituationalLevel.class,
            Duration.ofMinutes(15), 3.0, 50);

    private DomainProfiles() {
    }
}
