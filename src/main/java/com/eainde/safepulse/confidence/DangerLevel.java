package com.eainde.safepulse.confidence;

/** Overt-danger escalation. */
public enum DangerLevel implements EscalationLevel {
    SAFE(0),
    UNCERTAIN(60),
    HIGH(80),
    EMERGENCY(81);

    private final int threshold;

    DangerLevel(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public int threshold() {
        return threshold;
    }
}
