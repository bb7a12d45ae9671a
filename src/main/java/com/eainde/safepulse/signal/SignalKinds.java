package com.eainde.safepulse.signal;

import java.util.Locale;
import java.util.Optional;

public final class SignalKinds {

    private SignalKinds() {
    }

    /**
     * Looks up a kind by its wire name (case-insensitive, {@code -} and {@code _} interchangeable).
     */
    public static <K extends Enum<K> & SignalKind> Optional<K> resolve(Class<K> kindType, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (K kind : kindType.getEnumConstants()) {
            if (kind.wireName().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    static String wireNameOf(Enum<?> constant) {
        return constant.name().toLowerCase(Locale.ROOT);
    }
}
