package com.eainde.safepulse.intent;

import java.util.Locale;
import java.util.Optional;

/** Discrete distress events and their advisory score weights. */
public enum IntentEventKind {
    PHONE_DROP(30),
    KEYWORD_DETECTED(25),
    SCREAM_DETECTED(20),
    STRESS_SPIKE(15),
    STILLNESS(10);

    private final int scoreWeight;

    IntentEventKind(int scoreWeight) {
        this.scoreWeight = scoreWeight;
    }

    public int scoreWeight() {
        return scoreWeight;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<IntentEventKind> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (IntentEventKind kind : values()) {
            if (kind.wireName().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
