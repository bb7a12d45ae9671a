package com.eainde.safepulse.monitor;

import com.eainde.safepulse.alert.AlertDispatcher;
import com.eainde.safepulse.alert.AlertEvent;
import com.eainde.safepulse.confidence.ConfidenceState;
import com.eainde.safepulse.confidence.DangerLevel;
import com.eainde.safepulse.confidence.DomainProfiles;
import com.eainde.safepulse.signal.DangerSignalKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Overt-danger monitor. Entering {@link DangerLevel#EMERGENCY} always alerts; with
 * autonomous mode on it also triggers the autonomous incident response.
 */
@Slf4j
public class DangerMonitor extends AbstractSignalMonitor<DangerSignalKind, DangerLevel> {

    private volatile boolean autonomousMode;

    public DangerMonitor(Clock clock, AlertDispatcher alertDispatcher, boolean autonomousMode) {
        super(DomainProfiles.DANGER, clock, alertDispatcher);
        this.autonomousMode = autonomousMode;
    }

    public void setAutonomousMode(boolean enabled) {
        this.autonomousMode = enabled;
        log.info("Autonomous mode {}", enabled ? "enabled: the core will respond on its own" : "disabled: alert only");
    }

    public boolean isAutonomousMode() {
        return autonomousMode;
    }

    @Override
    protected void onHighestLevelEntered(ConfidenceState<DangerSignalKind, DangerLevel> state) {
        AlertEvent event = AlertEvent.of(state);
        alertDispatcher.alert(event);
        if (autonomousMode) {
            log.warn("Triggering autonomous emergency response at score {}", state.score());
            alertDispatcher.respond(event);
        }
    }
}
