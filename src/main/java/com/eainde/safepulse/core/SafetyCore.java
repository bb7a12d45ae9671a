package com.eainde.safepulse.core;

import com.eainde.safepulse.capture.DetectedSignal;
import com.eainde.safepulse.capture.DistressPhraseScorer;
import com.eainde.safepulse.capture.NavigationPatternDetector;
import com.eainde.safepulse.capture.SafeZone;
import com.eainde.safepulse.capture.SafeZoneEvaluator;
import com.eainde.safepulse.capture.TouchStressAnalyzer;
import com.eainde.safepulse.capture.UnlockPatternDetector;
import com.eainde.safepulse.confidence.ConfidenceState;
import com.eainde.safepulse.confidence.EscalationLevel;
import com.eainde.safepulse.error.InvalidSignalException;
import com.eainde.safepulse.intent.IntentCorrelator;
import com.eainde.safepulse.intent.IntentEventKind;
import com.eainde.safepulse.intent.IntentState;
import com.eainde.safepulse.monitor.AbstractSignalMonitor;
import com.eainde.safepulse.monitor.CoercionMonitor;
import com.eainde.safepulse.monitor.DangerMonitor;
import com.eainde.safepulse.monitor.SituationalMonitor;
import com.eainde.safepulse.signal.CoercionSignalKind;
import com.eainde.safepulse.signal.SafetyDomain;
import com.eainde.safepulse.signal.SignalKind;
import com.eainde.safepulse.signal.SignalKinds;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * The entry point capture collaborators push into.
 * <p>
 * Input arrives string-keyed (wire names such as {@code forced_unlock}) and is routed to
 * the monitor that owns the domain. Malformed input is rejected by the receiving
 * component, logged at WARN and reported as an empty result; it never reaches the
 * caller as an exception, since capture threads have nobody to hand it to.
 * </p>
 * <p>
 * Every monitor is started when the core is built. A monitor stopped later through
 * {@link #stopAll()} does not receive routed input; such input is logged at WARN. Its
 * history stays in place and decay continues once it is started again.
 * </p>
 */
@Log4j2
@Service
public class SafetyCore {

    private final DangerMonitor dangerMonitor;
    private final CoercionMonitor coercionMonitor;
    private final SituationalMonitor situationalMonitor;
    private final IntentCorrelator intentCorrelator;
    private final Clock clock;

    private final TouchStressAnalyzer touchStressAnalyzer = new TouchStressAnalyzer();
    private final UnlockPatternDetector unlockPatternDetector = new UnlockPatternDetector();
    private final NavigationPatternDetector navigationPatternDetector = new NavigationPatternDetector();
    private final DistressPhraseScorer distressPhraseScorer = new DistressPhraseScorer();
    private final SafeZoneEvaluator safeZoneEvaluator = new SafeZoneEvaluator();

    public SafetyCore(DangerMonitor dangerMonitor,
                      CoercionMonitor coercionMonitor,
                      SituationalMonitor situationalMonitor,
                      IntentCorrelator intentCorrelator,
                      Clock clock) {
        this.dangerMonitor = dangerMonitor;
        this.coercionMonitor = coercionMonitor;
        this.situationalMonitor = situationalMonitor;
        this.intentCorrelator = intentCorrelator;
        this.clock = clock;
        startAll();
    }

    /**
     * Routes a signal to the monitor for {@code domain}.
     *
     * @param domain      one of DANGER, COERCION or SITUATIONAL
     * @param kind        the kind's wire name within that domain
     * @return the state after insertion; empty if the input was invalid or the monitor is stopped
     */
    public Optional<ConfidenceState<?, ?>> addSignal(SafetyDomain domain, String kind, double value, String description) {
        if (domain == null) {
            log.warn("Ignoring signal without a domain (kind={})", kind);
            return Optional.empty();
        }
        return switch (domain) {
            case DANGER -> route(dangerMonitor, kind, value, description);
            case COERCION -> route(coercionMonitor, kind, value, description);
            case SITUATIONAL -> route(situationalMonitor, kind, value, description);
            case INTENT -> {
                log.warn("Intent events are registered through registerEvent, not addSignal (kind={})", kind);
                yield Optional.empty();
            }
        };
    }

    /** Registers an intent event by wire name ({@code phone_drop}, {@code keyword_detected}, ...). */
    public Optional<IntentState> registerEvent(String kind, double confidence) {
        Optional<IntentEventKind> eventKind = IntentEventKind.fromWireName(kind);
        if (eventKind.isEmpty()) {
            log.warn("Ignoring intent event with unknown kind '{}'", kind);
            return Optional.empty();
        }
        try {
            return Optional.of(intentCorrelator.registerEvent(eventKind.get(), confidence));
        } catch (InvalidSignalException e) {
            log.warn("Ignoring invalid intent event {}: {}", kind, e.getMessage());
            return Optional.empty();
        }
    }

    public void recordTouch(double pressure) {
        touchStressAnalyzer.recordTouch(pressure, clock.instant()).forEach(this::feedCoercion);
    }

    public void recordUnlock() {
        unlockPatternDetector.recordUnlock(clock.instant()).ifPresent(this::feedCoercion);
    }

    public void recordNavigation(String path) {
        navigationPatternDetector.recordNavigation(path, clock.instant()).ifPresent(this::feedCoercion);
    }

    public void recordTranscript(String transcript) {
        distressPhraseScorer.score(transcript).ifPresent(signal -> feed(dangerMonitor, signal));
    }

    public void recordPosition(double latitude, double longitude, List<SafeZone> zones) {
        LocalTime localTime = LocalTime.now(clock);
        safeZoneEvaluator.evaluate(latitude, longitude, zones, localTime)
                .forEach(signal -> feed(dangerMonitor, signal));
    }

    public void startAll() {
        dangerMonitor.start();
        coercionMonitor.start();
        situationalMonitor.start();
    }

    public void stopAll() {
        dangerMonitor.stop();
        coercionMonitor.stop();
        situationalMonitor.stop();
    }

    /** Clears every monitor, the intent window and the capture reducers' rolling state. */
    public void resetAll() {
        dangerMonitor.resetState();
        coercionMonitor.resetState();
        situationalMonitor.resetState();
        intentCorrelator.resetIntent();
        touchStressAnalyzer.reset();
        unlockPatternDetector.reset();
        navigationPatternDetector.reset();
    }

    public DangerMonitor danger() {
        return dangerMonitor;
    }

    public CoercionMonitor coercion() {
        return coercionMonitor;
    }

    public SituationalMonitor situational() {
        return situationalMonitor;
    }

    public IntentCorrelator intent() {
        return intentCorrelator;
    }

    private void feedCoercion(DetectedSignal<CoercionSignalKind> signal) {
        feed(coercionMonitor, signal);
    }

    private <K extends Enum<K> & SignalKind, L extends Enum<L> & EscalationLevel> void feed(
            AbstractSignalMonitor<K, L> monitor, DetectedSignal<K> signal) {
        if (!monitor.isMonitoring()) {
            log.warn("{} monitor stopped, dropping detected {}", monitor.domain(), signal.kind());
            return;
        }
        monitor.accept(Optional.of(signal));
    }

    private <K extends Enum<K> & SignalKind, L extends Enum<L> & EscalationLevel> Optional<ConfidenceState<?, ?>> route(
            AbstractSignalMonitor<K, L> monitor, String kind, double value, String description) {
        if (!monitor.isMonitoring()) {
            log.warn("{} monitor stopped, dropping {}={}", monitor.domain(), kind, value);
            return Optional.empty();
        }
        Optional<K> signalKind = SignalKinds.resolve(monitor.profile().kindType(), kind);
        if (signalKind.isEmpty()) {
            log.warn("Ignoring {} signal with unknown kind '{}'", monitor.domain(), kind);
            return Optional.empty();
        }
        try {
            return Optional.of(monitor.addSignal(signalKind.get(), value, description));
        } catch (InvalidSignalException e) {
            log.warn("Ignoring invalid {} signal {}={}: {}", monitor.domain(), kind, value, e.getMessage());
            return Optional.empty();
        }
    }
}
