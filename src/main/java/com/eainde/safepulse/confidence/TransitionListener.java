package com.eainde.safepulse.confidence;

import com.eainde.safepulse.signal.SignalKind;

/**
 * Receives level changes. Called synchronously on the ingesting thread while the
 * aggregator is held, so implementations must only update local state or hand off.
 */
@FunctionalInterface
public interface TransitionListener<K extends Enum<K> & SignalKind, L extends Enum<L> & EscalationLevel> {

    void onTransition(LevelTransition<L> transition, ConfidenceState<K, L> state);
}
