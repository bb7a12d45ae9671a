package com.eainde.safepulse.signal;

/** Evidence categories of the coercion domain. */
public enum CoercionSignalKind implements SignalKind {
    FORCED_UNLOCK(1.5),
    SHAKING_HANDS(1.3),
    ERRATIC_TOUCH(1.2),
    RAPID_NAVIGATION(1.0),
    UNUSUAL_TIMING(0.8),
    STRESS_PATTERN(1.4);

    private final double weight;

    CoercionSignalKind(double weight) {
        this.weight = weight;
    }

    @Override
    public double weight() {
        return weight;
    }

    @Override
    public String wireName() {
        return SignalKinds.wireNameOf(this);
    }
}
