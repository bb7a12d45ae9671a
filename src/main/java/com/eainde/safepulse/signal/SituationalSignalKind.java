package com.eainde.safepulse.signal;

/** Evidence categories of the pre-danger (situational risk) domain. */
public enum SituationalSignalKind implements SignalKind {
    MOTION(1.2),
    LOCATION(1.5),
    TIME(0.8),
    HANDLING(1.3),
    NOISE(0.9),
    ROUTINE(1.4),
    STILLNESS(1.1);

    private final double weight;

    SituationalSignalKind(double weight) {
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
