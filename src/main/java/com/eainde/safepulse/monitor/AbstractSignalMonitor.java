package com.eainde.safepulse.monitor;

import com.eainde.safepulse.alert.AlertDispatcher;
import com.eainde.safepulse.alert.AlertEvent;
import com.eainde.safepulse.capture.DetectedSignal;
import com.eainde.safepulse.confidence.ConfidenceAggregator;
import com.eainde.safepulse.confidence.ConfidenceProfile;
import com.eainde.safepulse.confidence.ConfidenceState;
import com.eainde.safepulse.confidence.EscalationLevel;
import com.eainde.safepulse.confidence.LevelTransition;
import com.eainde.safepulse.confidence.TransitionListener;
import com.eainde.safepulse.signal.SafetyDomain;
import com.eainde.safepulse.signal.SignalKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Base class for the per-domain monitors.
 * <p>
 * A monitor owns exactly one {@link ConfidenceAggregator} and is the only writer of it.
 * Entering the domain's highest level hands an {@link AlertEvent} to the
 * {@link AlertDispatcher} once per crossing; subclasses add their domain rules in
 * {@link #onTransition} and {@link #onHighestLevelEntered}.
 * </p>
 * <p>
 * {@link #stop()} only marks the monitor as no longer listening to capture
 * collaborators. History is kept, so after {@link #start()} decay continues against
 * the original timestamps.
 * </p>
 */
public abstract class AbstractSignalMonitor<K extends Enum<K> & SignalKind, L extends Enum<L> & EscalationLevel> {

    private static final Logger log = LoggerFactory.getLogger(AbstractSignalMonitor.class);

    protected final ConfidenceAggregator<K, L> aggregator;
    protected final AlertDispatcher alertDispatcher;
    private volatile boolean monitoring;

    protected AbstractSignalMonitor(ConfidenceProfile<K, L> profile, Clock clock, AlertDispatcher alertDispatcher) {
        this.aggregator = new ConfidenceAggregator<>(profile, clock);
        this.alertDispatcher = alertDispatcher;
        this.aggregator.addListener(this::handleTransition);
    }

    public void start() {
        if (!monitoring) {
            log.info("Starting {} monitor", domain());
            monitoring = true;
        }
    }

    public void stop() {
        if (monitoring) {
            log.info("Stopping {} monitor; {} signals retained", domain(), aggregator.peek(now()).signals().size());
            monitoring = false;
        }
    }

    public boolean isMonitoring() {
        return monitoring;
    }

    public ConfidenceState<K, L> addSignal(K kind, double value, String description) {
        ConfidenceState<K, L> state = aggregator.addSignal(kind, value, description);
        log.debug("{} signal {}={} -> score={} level={}", domain(), kind, value, state.score(), state.level());
        return state;
    }

    public Optional<ConfidenceState<K, L>> accept(Optional<DetectedSignal<K>> detected) {
        return detected.map(signal -> addSignal(signal.kind(), signal.value(), signal.description()));
    }

    /** Re-derives the state at the current instant; decay may lower the level. */
    public ConfidenceState<K, L> evaluate() {
        return aggregator.evaluate();
    }

    public ConfidenceState<K, L> evaluate(Instant now) {
        return aggregator.evaluate(now);
    }

    public void addTransitionListener(TransitionListener<K, L> listener) {
        aggregator.addListener(listener);
    }

    /** Clears history, level and any domain flags. */
    public void resetState() {
        aggregator.clear();
        onReset();
        log.info("{} monitor state reset", domain());
    }

    public SafetyDomain domain() {
        return aggregator.profile().domain();
    }

    public ConfidenceProfile<K, L> profile() {
        return aggregator.profile();
    }

    protected Instant now() {
        return aggregator.clock().instant();
    }

    protected void onTransition(LevelTransition<L> transition, ConfidenceState<K, L> state) {
    }

    protected void onHighestLevelEntered(ConfidenceState<K, L> state) {
        alertDispatcher.alert(AlertEvent.of(state));
    }

    protected void onReset() {
    }

    private void handleTransition(LevelTransition<L> transition, ConfidenceState<K, L> state) {
        onTransition(transition, state);
        if (transition.entersHighest()) {
            onHighestLevelEntered(state);
        }
    }
}
