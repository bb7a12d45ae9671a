package com.eainde.safepulse.monitor;

import com.eainde.safepulse.alert.AlertDispatcher;
import com.eainde.safepulse.confidence.CoercionLevel;
import com.eainde.safepulse.confidence.ConfidenceState;
import com.eainde.safepulse.confidence.DomainProfiles;
import com.eainde.safepulse.signal.CoercionSignalKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Anti-coercion monitor.
 * <p>
 * Reaching {@link CoercionLevel#CONFIRMED} latches silent mode: the app keeps looking
 * normal to a coercer while escalation continues in the background. The latch survives
 * de-escalation and is cleared only by {@link #resetSilentMode()} or {@link #resetState()}.
 * </p>
 */
@Slf4j
public class CoercionMonitor extends AbstractSignalMonitor<CoercionSignalKind, CoercionLevel> {

    private final AtomicBoolean silentMode = new AtomicBoolean();
    private volatile boolean outwardlyActive = true;

    public CoercionMonitor(Clock clock, AlertDispatcher alertDispatcher) {
        super(DomainProfiles.COERCION, clock, alertDispatcher);
    }

    public CoercionState currentState() {
        return new CoercionState(evaluate(), silentMode.get(), outwardlyActive);
    }

    public boolean isSilentMode() {
        return silentMode.get();
    }

    public void enableSilentMode() {
        silentMode.set(true);
        log.info("Silent mode enabled");
    }

    /**
     * Reports the monitor as shut down to anyone looking at the device while monitoring
     * continues and silent mode is latched.
     */
    public void fakeShutdown() {
        silentMode.set(true);
        outwardlyActive = false;
        log.info("Fake shutdown: monitoring continues silently");
    }

    public boolean isOutwardlyActive() {
        return outwardlyActive;
    }

    public void resetSilentMode() {
        silentMode.set(false);
        outwardlyActive = true;
        log.info("Silent mode cleared");
    }

    @Override
    protected void onHighestLevelEntered(ConfidenceState<CoercionSignalKind, CoercionLevel> state) {
        if (silentMode.compareAndSet(false, true)) {
            log.warn("Coercion confirmed at score {}; silent mode latched", state.score());
        }
        super.onHighestLevelEntered(state);
    }

    @Override
    protected void onReset() {
        resetSilentMode();
    }
}
