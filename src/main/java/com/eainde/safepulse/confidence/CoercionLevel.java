package com.eainde.safepulse.confidence;

/** Coercion escalation. */
public enum CoercionLevel implements EscalationLevel {
    NONE(0),
    SUSPECTED(40),
    CONFIRMED(70);

    private final int threshold;

    CoercionLevel(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public int threshold() {
        return threshold;
    }
}
