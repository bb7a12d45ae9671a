package com.eainde.safepulse.confidence;

import com.eainde.safepulse.signal.Signal;
import com.eainde.safepulse.signal.SignalKind;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Decaying weighted sum over a signal history. Pure: "now" is always passed in.
 */
public final class ConfidenceCalculator {

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private ConfidenceCalculator() {
    }

    public static <K extends Enum<K> & SignalKind> int score(
            List<Signal<K>> signals, ConfidenceProfile<K, ?> profile, Instant now) {
        double weightedSum = 0;
        for (Signal<K> signal : signals) {
            weightedSum += contribution(signal, profile.halfLife(), now);
        }
        return (int) Math.min(100, Math.round(weightedSum / profile.normalizer()));
    }

    public static <K extends Enum<K> & SignalKind> double contribution(
            Signal<K> signal, Duration halfLife, Instant now) {
        return signal.value() * signal.kind().weight() * decay(signal.timestamp(), halfLife, now);
    }

    /**
     * Linear fade from 1 at observation time to 0 at {@code halfLife}. A timestamp ahead
     * of {@code now} (clock skew) counts as age zero.
     */
    public static double decay(Instant observedAt, Duration halfLife, Instant now) {
        double ageMinutes = Math.max(0, Duration.between(observedAt, now).toMillis() / MILLIS_PER_MINUTE);
        double halfLifeMinutes = halfLife.toMillis() / MILLIS_PER_MINUTE;
        return Math.max(0, 1 - ageMinutes / halfLifeMinutes);
    }
}
