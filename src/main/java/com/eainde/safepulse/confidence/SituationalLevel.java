package com.eainde.safepulse.confidence;

/** Pre-danger escalation of the situational-risk domain. */
public enum SituationalLevel implements EscalationLevel {
    NONE(0),
    MONITORING(30),
    ARMED(50),
    CRITICAL(75);

    private final int threshold;

    SituationalLevel(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public int threshold() {
        return threshold;
    }
}
