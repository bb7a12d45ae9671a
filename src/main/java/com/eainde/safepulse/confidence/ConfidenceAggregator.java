package com.eainde.safepulse.confidence;

import com.eainde.safepulse.error.InvalidSignalException;
import com.eainde.safepulse.signal.Signal;
import com.eainde.safepulse.signal.SignalHistory;
import com.eainde.safepulse.signal.SignalKind;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns a bounded history of signals into a 0-100 confidence score and drives the
 * domain's escalation state machine.
 * <p>
 * One instance per domain. All mutation and evaluation is serialized on the instance,
 * giving the single-writer discipline the history requires. Recomputation is lazy: it
 * happens on every insertion and on every explicit {@link #evaluate(Instant)} poll,
 * never on a timer.
 * </p>
 */
public class ConfidenceAggregator<K extends Enum<K> & SignalKind, L extends Enum<L> & EscalationLevel> {

    private final ConfidenceProfile<K, L> profile;
    private final Clock clock;
    private final SignalHistory<K> history;
    private final EscalationStateMachine<K, L> stateMachine;

    public ConfidenceAggregator(ConfidenceProfile<K, L> profile, Clock clock) {
        this.profile = profile;
        this.clock = clock;
        this.history = new SignalHistory<>(profile.capacity());
        this.stateMachine = new EscalationStateMachine<>(profile.domain(), profile.lowestLevel(), clock.instant());
    }

    public ConfidenceState<K, L> addSignal(K kind, double value, String description) {
        return addSignal(kind, value, description, clock.instant());
    }

    /**
     * Appends a signal observed at {@code observedAt} and re-evaluates at the clock's current instant.
     *
     * @throws InvalidSignalException if the kind is missing or the value is negative or not finite
     */
    public synchronized ConfidenceState<K, L> addSignal(K kind, double value, String description, Instant observedAt) {
        if (kind == null) {
            throw new InvalidSignalException("Signal kind is required for " + profile.domain());
        }
        if (!Double.isFinite(value) || value < 0) {
            throw new InvalidSignalException("Signal value must be a finite, non-negative number: " + value);
        }
        if (observedAt == null) {
            throw new InvalidSignalException("Signal timestamp is required");
        }
        history.append(new Signal<>(kind, value, observedAt, description));
        return evaluate(clock.instant());
    }

    public ConfidenceState<K, L> evaluate() {
        return evaluate(clock.instant());
    }

    public synchronized ConfidenceState<K, L> evaluate(Instant now) {
        ConfidenceState<K, L> state = peek(now);
        stateMachine.apply(state);
        return state;
    }

    /** Derives the state at {@code now} without driving the state machine. */
    public synchronized ConfidenceState<K, L> peek(Instant now) {
        int score = ConfidenceCalculator.score(history.snapshot(), profile, now);
        return new ConfidenceState<>(profile.domain(), score, profile.levelFor(score), history.snapshot(), now);
    }

    /** Drops all history and returns the state machine to the lowest level silently. */
    public synchronized void clear() {
        history.clear();
        stateMachine.reset(clock.instant());
    }

    public void addListener(TransitionListener<K, L> listener) {
        stateMachine.addListener(listener);
    }

    public L currentLevel() {
        return stateMachine.currentLevel();
    }

    public Instant levelEnteredAt() {
        return stateMachine.enteredAt();
    }

    public ConfidenceProfile<K, L> profile() {
        return profile;
    }

    public Clock clock() {
        return clock;
    }
}
