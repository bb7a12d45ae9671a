package com.eainde.safepulse.intent;

import com.eainde.safepulse.alert.AlertDispatcher;
import com.eainde.safepulse.alert.AlertEvent;
import com.eainde.safepulse.alert.SignalSnapshot;
import com.eainde.safepulse.error.InvalidSignalException;
import com.eainde.safepulse.signal.SafetyDomain;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Multi-signal intent verification used to gate high-consequence automatic actions.
 * <p>
 * Intent is confirmed when, inside the trailing two-minute window, there is a phone drop
 * together with at least one keyword, or at least two keywords. Scream, stress and
 * stillness only raise the advisory score. Confirmation fires the response once and
 * stays latched until {@link #resetIntent()}.
 * </p>
 */
@Slf4j
public class IntentCorrelator {

    public static final Duration WINDOW = Duration.ofMinutes(2);
    public static final int HISTORY_CAPACITY = 50;

    private static final int DROP_AND_KEYWORD_BONUS = 20;
    private static final int SCREAM_AND_KEYWORD_BONUS = 15;
    private static final int DOUBLE_KEYWORD_BONUS = 25;

    private final Clock clock;
    private final AlertDispatcher alertDispatcher;
    private final Deque<IntentEvent> events = new ArrayDeque<>(HISTORY_CAPACITY);
    private boolean triggered;

    public IntentCorrelator(Clock clock, AlertDispatcher alertDispatcher) {
        this.clock = clock;
        this.alertDispatcher = alertDispatcher;
    }

    /**
     * Records an event observed now and re-evaluates the rule over the trailing window.
     *
     * @throws InvalidSignalException if the kind is missing or confidence is outside [0, 1]
     */
    public synchronized IntentState registerEvent(IntentEventKind kind, double confidence) {
        if (kind == null) {
            throw new InvalidSignalException("Intent event kind is required");
        }
        if (!Double.isFinite(confidence) || confidence < 0 || confidence > 1) {
            throw new InvalidSignalException("Intent confidence must be within [0, 1]: " + confidence);
        }
        Instant now = clock.instant();
        if (events.size() == HISTORY_CAPACITY) {
            events.removeFirst();
        }
        events.addLast(new IntentEvent(kind, confidence, now));
        log.debug("Intent event {} (confidence={})", kind, confidence);

        IntentState state = evaluate(now);
        if (state.confirmed() && !triggered) {
            triggered = true;
            state = withTriggered(state);
            log.warn("INTENT CONFIRMED - multi-signal verification passed (score={})", state.confirmationScore());
            AlertEvent event = toAlert(state, now);
            alertDispatcher.alert(event);
            alertDispatcher.respond(event);
        }
        return state;
    }

    public IntentState registerPhoneDrop(double confidence) {
        return registerEvent(IntentEventKind.PHONE_DROP, confidence);
    }

    public IntentState registerKeyword(double confidence) {
        return registerEvent(IntentEventKind.KEYWORD_DETECTED, confidence);
    }

    public IntentState registerScream(double confidence) {
        return registerEvent(IntentEventKind.SCREAM_DETECTED, confidence);
    }

    public IntentState registerStressSpike(double confidence) {
        return registerEvent(IntentEventKind.STRESS_SPIKE, confidence);
    }

    public IntentState registerStillness(double confidence) {
        return registerEvent(IntentEventKind.STILLNESS, confidence);
    }

    public synchronized IntentState currentState() {
        return evaluate(clock.instant());
    }

    /** Clears history and re-arms the confirmation callback. */
    public synchronized void resetIntent() {
        events.clear();
        triggered = false;
        log.info("Intent verification reset");
    }

    private IntentState evaluate(Instant now) {
        List<IntentEvent> all = List.copyOf(events);
        List<IntentEvent> recent = all.stream().filter(e -> inWindow(e, now)).toList();

        boolean hasDrop = recent.stream().anyMatch(e -> e.kind() == IntentEventKind.PHONE_DROP);
        boolean hasScream = recent.stream().anyMatch(e -> e.kind() == IntentEventKind.SCREAM_DETECTED);
        int keywordCount = (int) recent.stream().filter(e -> e.kind() == IntentEventKind.KEYWORD_DETECTED).count();

        boolean confirmed = (hasDrop && keywordCount >= 1) || keywordCount >= 2;

        double score = 0;
        for (IntentEvent event : recent) {
            score += event.kind().scoreWeight() * event.confidence();
        }
        if (hasDrop && keywordCount >= 1) {
            score += DROP_AND_KEYWORD_BONUS;
        }
        if (hasScream && keywordCount >= 1) {
            score += SCREAM_AND_KEYWORD_BONUS;
        }
        if (keywordCount >= 2) {
            score += DOUBLE_KEYWORD_BONUS;
        }

        Instant lastDrop = all.stream()
                .filter(e -> e.kind() == IntentEventKind.PHONE_DROP)
                .map(IntentEvent::timestamp)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return new IntentState(all, confirmed, (int) Math.min(100, Math.round(score)), keywordCount, lastDrop, triggered);
    }

    private static boolean inWindow(IntentEvent event, Instant now) {
        return Duration.between(event.timestamp(), now).compareTo(WINDOW) < 0;
    }

    private static IntentState withTriggered(IntentState state) {
        return new IntentState(state.events(), state.confirmed(), state.confirmationScore(),
                state.keywordCount(), state.lastDropTime(), true);
    }

    private static AlertEvent toAlert(IntentState state, Instant now) {
        List<SignalSnapshot> snapshots = state.events().stream()
                .filter(e -> inWindow(e, now))
                .map(e -> new SignalSnapshot(e.kind().wireName(), e.confidence(), e.timestamp(), "intent event"))
                .toList();
        return new AlertEvent(SafetyDomain.INTENT, "CONFIRMED", state.confirmationScore(), snapshots, now);
    }
}
