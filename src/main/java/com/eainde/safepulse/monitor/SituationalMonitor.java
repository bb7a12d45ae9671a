package com.eainde.safepulse.monitor;

import com.eainde.safepulse.alert.AlertDispatcher;
import com.eainde.safepulse.confidence.ConfidenceState;
import com.eainde.safepulse.confidence.DomainProfiles;
import com.eainde.safepulse.confidence.SituationalLevel;
import com.eainde.safepulse.signal.Signal;
import com.eainde.safepulse.signal.SituationalSignalKind;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Pre-danger monitor. Escalates quietly through MONITORING and ARMED before danger is
 * overt; every level change goes to the registered transition listeners, and entering
 * CRITICAL alerts.
 */
public class SituationalMonitor extends AbstractSignalMonitor<SituationalSignalKind, SituationalLevel> {

    public static final String ROUTE_DEVIATION = "route_deviation";
    public static final String GRIP_TENSION = "grip_tension";
    public static final String SUDDEN_SILENCE = "sudden_silence";
    public static final String PROLONGED_STILLNESS = "prolonged_stillness";
    public static final String UNUSUAL_TIME = "unusual_time";

    public SituationalMonitor(Clock clock, AlertDispatcher alertDispatcher) {
        super(DomainProfiles.SITUATIONAL, clock, alertDispatcher);
    }

    public PreDangerState currentState() {
        Instant now = now();
        ConfidenceState<SituationalSignalKind, SituationalLevel> confidence = evaluate(now);
        return new PreDangerState(confidence, triggers(confidence.signals()), timeInState(now));
    }

    /** Time spent at the current level; zero while at NONE. */
    public Duration timeInState(Instant now) {
        if (aggregator.currentLevel() == SituationalLevel.NONE) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(aggregator.levelEnteredAt(), now);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    static List<String> triggers(List<Signal<SituationalSignalKind>> signals) {
        List<String> triggers = new ArrayList<>();
        addIf(triggers, ROUTE_DEVIATION, signals, s -> s.kind() == SituationalSignalKind.LOCATION && s.value() > 30);
        addIf(triggers, GRIP_TENSION, signals, s -> s.kind() == SituationalSignalKind.HANDLING && s.value() > 40);
        addIf(triggers, SUDDEN_SILENCE, signals, s -> s.kind() == SituationalSignalKind.NOISE && s.value() < 20);
        addIf(triggers, PROLONGED_STILLNESS, signals, s -> s.kind() == SituationalSignalKind.STILLNESS && s.value() > 50);
        addIf(triggers, UNUSUAL_TIME, signals, s -> s.kind() == SituationalSignalKind.TIME && s.value() > 30);
        return triggers;
    }

    private static void addIf(List<String> triggers, String name,
                              List<Signal<SituationalSignalKind>> signals,
                              Predicate<Signal<SituationalSignalKind>> condition) {
        if (signals.stream().anyMatch(condition)) {
            triggers.add(name);
        }
    }
}
