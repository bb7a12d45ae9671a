package com.eainde.safepulse.capture;

import com.eainde.safepulse.signal.CoercionSignalKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/** Emits {@code rapid_navigation} when the last five screen changes span under three seconds. */
public class NavigationPatternDetector {

    static final int WINDOW = 5;
    static final int CAPACITY = 20;
    static final Duration MAX_SPAN = Duration.ofSeconds(3);
    static final double RAPID_NAVIGATION_VALUE = 40;

    private final Deque<Navigation> history = new ArrayDeque<>();

    public synchronized Optional<DetectedSignal<CoercionSignalKind>> recordNavigation(String path, Instant at) {
        history.addLast(new Navigation(path, at));
        if (history.size() > CAPACITY) {
            history.removeFirst();
        }
        if (history.size() < WINDOW) {
            return Optional.empty();
        }
        Instant first = history.stream().skip(history.size() - WINDOW).findFirst().orElseThrow().at();
        if (Duration.between(first, at).compareTo(MAX_SPAN) < 0) {
            return Optional.of(new DetectedSignal<>(CoercionSignalKind.RAPID_NAVIGATION, RAPID_NAVIGATION_VALUE,
                    "Rapid navigation detected"));
        }
        return Optional.empty();
    }

    public synchronized void reset() {
        history.clear();
    }

    private record Navigation(String path, Instant at) {
    }
}
