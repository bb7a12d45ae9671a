package com.eainde.safepulse.capture;

import com.eainde.safepulse.signal.CoercionSignalKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns sampled touch pressure into coercion signals.
 * <p>
 * The first {@value #BASELINE_TOUCHES} touches form the user's baseline. Once more than
 * {@value #MIN_TOUCHES_FOR_COMPARISON} touches are held, the last
 * {@value #RECENT_WINDOW} are compared against it: pressure variance above
 * {@value #VARIANCE_THRESHOLD} suggests trembling, and a mean touch rate above twice the
 * baseline suggests someone else is driving the phone.
 * </p>
 */
public class TouchStressAnalyzer {

    static final int BASELINE_TOUCHES = 10;
    static final int MIN_TOUCHES_FOR_COMPARISON = 20;
    static final int RECENT_WINDOW = 10;
    static final int CAPACITY = 50;
    static final double VARIANCE_THRESHOLD = 0.3;
    static final double DEFAULT_PRESSURE = 0.5;
    static final double ERRATIC_TOUCH_VALUE = 35;

    private final Deque<Touch> touches = new ArrayDeque<>();
    private Baseline baseline;

    /**
     * Records one touch.
     *
     * @param pressure estimated pressure; zero, negative or NaN falls back to {@value #DEFAULT_PRESSURE}
     */
    public synchronized List<DetectedSignal<CoercionSignalKind>> recordTouch(double pressure, Instant at) {
        Touch last = touches.peekLast();
        double speed = 0;
        if (last != null) {
            long elapsedMillis = Duration.between(last.at(), at).toMillis();
            speed = elapsedMillis > 0 ? 1000.0 / elapsedMillis : 0;
        }
        touches.addLast(new Touch(pressure > 0 ? pressure : DEFAULT_PRESSURE, speed, at));
        if (touches.size() > CAPACITY) {
            touches.removeFirst();
        }

        if (baseline == null && touches.size() >= BASELINE_TOUCHES) {
            baseline = new Baseline(
                    touches.stream().mapToDouble(Touch::pressure).average().orElse(DEFAULT_PRESSURE),
                    touches.stream().mapToDouble(Touch::speed).average().orElse(0));
        }
        if (baseline == null || touches.size() <= MIN_TOUCHES_FOR_COMPARISON) {
            return List.of();
        }

        List<Touch> recent = new ArrayList<>(touches).subList(touches.size() - RECENT_WINDOW, touches.size());
        double meanPressure = recent.stream().mapToDouble(Touch::pressure).average().orElse(0);
        double meanSpeed = recent.stream().mapToDouble(Touch::speed).average().orElse(0);
        double variance = recent.stream()
                .mapToDouble(t -> Math.pow(t.pressure() - meanPressure, 2))
                .sum() / recent.size();

        List<DetectedSignal<CoercionSignalKind>> detected = new ArrayList<>();
        if (variance > VARIANCE_THRESHOLD) {
            detected.add(new DetectedSignal<>(CoercionSignalKind.SHAKING_HANDS, Math.min(50, variance * 100),
                    "Trembling touch detected"));
        }
        if (meanSpeed > baseline.speed() * 2) {
            detected.add(new DetectedSignal<>(CoercionSignalKind.ERRATIC_TOUCH, ERRATIC_TOUCH_VALUE,
                    "Erratic touch speed"));
        }
        return detected;
    }

    public synchronized void reset() {
        touches.clear();
        baseline = null;
    }

    public synchronized boolean hasBaseline() {
        return baseline != null;
    }

    private record Touch(double pressure, double speed, Instant at) {
    }

    private record Baseline(double pressure, double speed) {
    }
}
