package com.eainde.safepulse.confidence;

import com.eainde.safepulse.signal.SafetyDomain;
import com.eainde.safepulse.signal.SignalKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps each freshly derived state onto its level and reports boundary crossings.
 * <p>
 * Memory is limited to the current level: the level is a pure function of the score,
 * so decay can de-escalate as readily as new evidence escalates. A transition is
 * emitted exactly once per crossing; evaluating the same level again emits nothing.
 * </p>
 */
public class EscalationStateMachine<K extends Enum<K> & SignalKind, L extends Enum<L> & EscalationLevel> {

    private static final Logger log = LoggerFactory.getLogger(EscalationStateMachine.class);

    private final SafetyDomain domain;
    private final L initialLevel;
    private final List<TransitionListener<K, L>> listeners = new CopyOnWriteArrayList<>();
    private volatile L currentLevel;
    private volatile Instant enteredAt;

    public EscalationStateMachine(SafetyDomain domain, L initialLevel, Instant createdAt) {
        this.domain = domain;
        this.initialLevel = initialLevel;
        this.currentLevel = initialLevel;
        this.enteredAt = createdAt;
    }

    public void addListener(TransitionListener<K, L> listener) {
        listeners.add(listener);
    }

    /**
     * Moves to {@code state.level()} if it differs from the current level and notifies listeners.
     */
    public Optional<LevelTransition<L>> apply(ConfidenceState<K, L> state) {
        L target = state.level();
        if (target == currentLevel) {
            return Optional.empty();
        }
        LevelTransition<L> transition = new LevelTransition<>(
                domain, currentLevel, target, state.score(), state.evaluatedAt());
        currentLevel = target;
        enteredAt = state.evaluatedAt();

        log.info("{} level {} -> {} (score={})", domain, transition.from(), transition.to(), transition.score());
        for (TransitionListener<K, L> listener : listeners) {
            try {
                listener.onTransition(transition, state);
            } catch (RuntimeException e) {
                log.error("Transition listener failed for {} {} -> {}", domain, transition.from(), transition.to(), e);
            }
        }
        return Optional.of(transition);
    }

    /** Returns to the initial level without notifying anyone. */
    public void reset(Instant at) {
        currentLevel = initialLevel;
        enteredAt = at;
    }

    public L currentLevel() {
        return currentLevel;
    }

    public Instant enteredAt() {
        return enteredAt;
    }
}
