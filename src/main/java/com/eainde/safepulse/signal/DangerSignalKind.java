package com.eainde.safepulse.signal;

/** Evidence categories of the overt-danger domain. Weights are percentages; the danger profile normalizes by 100. */
public enum DangerSignalKind implements SignalKind {
    MOTION(25),
    VOICE(30),
    INACTIVITY(20),
    LOCATION(15),
    TIME(10),
    PATTERN(20);

    private final double weight;

    DangerSignalKind(double weight) {
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
