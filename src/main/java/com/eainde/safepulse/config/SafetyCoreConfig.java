package com.eainde.safepulse.config;

import com.eainde.safepulse.alert.AlertDispatcher;
import com.eainde.safepulse.alert.AlertNotifier;
import com.eainde.safepulse.alert.IncidentResponder;
import com.eainde.safepulse.alert.LoggingAlertNotifier;
import com.eainde.safepulse.intent.IntentCorrelator;
import com.eainde.safepulse.monitor.CoercionMonitor;
import com.eainde.safepulse.monitor.DangerMonitor;
import com.eainde.safepulse.monitor.SituationalMonitor;
import com.eainde.safepulse.thread.MdcAwareExecutor;
import com.eainde.safepulse.truthlock.EvidenceReleaseNotifier;
import com.eainde.safepulse.truthlock.InMemoryTruthLockRepository;
import com.eainde.safepulse.truthlock.JdbcTruthLockRepository;
import com.eainde.safepulse.truthlock.TruthLockRepository;
import com.eainde.safepulse.truthlock.TruthLockService;
import com.eainde.safepulse.voice.AudioCapture;
import com.eainde.safepulse.voice.FeatureExtractor;
import com.eainde.safepulse.voice.InMemoryVoiceprintRepository;
import com.eainde.safepulse.voice.JsonFileVoiceprintRepository;
import com.eainde.safepulse.voice.UnavailableAudioCapture;
import com.eainde.safepulse.voice.VoiceMatcher;
import com.eainde.safepulse.voice.VoiceprintRepository;
import com.eainde.safepulse.voice.VoiceprintService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the decision core. Collaborators (alerting, incident response, evidence release,
 * audio capture) fall back to logging or unavailable defaults when the host registers none.
 */
@Configuration
@EnableScheduling
public class SafetyCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SafetyCoreConfig.class);

    // =========================================================================
    //  Infrastructure
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor alertExecutor(@Value("${safepulse.alert.dispatch-threads:2}") int threads) {
        return new MdcAwareExecutor(threads, "safepulse-dispatch");
    }

    /** One bean serves all three collaborator roles; a host replacing it must supply all three. */
    @Bean
    @ConditionalOnMissingBean({
            AlertNotifier.class,
            IncidentResponder.class,
            EvidenceReleaseNotifier.class})
    public LoggingAlertNotifier loggingAlertNotifier(ObjectMapper objectMapper) {
        log.info("No alert collaborators registered, alerts will be written to the log");
        return new LoggingAlertNotifier(objectMapper);
    }

    @Bean
    public AlertDispatcher alertDispatcher(AlertNotifier alertNotifier,
                                           IncidentResponder incidentResponder,
                                           MdcAwareExecutor alertExecutor) {
        return new AlertDispatcher(alertNotifier, incidentResponder, alertExecutor);
    }

    // =========================================================================
    //  Monitors
    // =========================================================================

    @Bean
    public DangerMonitor dangerMonitor(Clock clock, AlertDispatcher alertDispatcher,
                                       @Value("${safepulse.danger.autonomous-mode:false}") boolean autonomousMode) {
        return new DangerMonitor(clock, alertDispatcher, autonomousMode);
    }

    @Bean
    public CoercionMonitor coercionMonitor(Clock clock, AlertDispatcher alertDispatcher) {
        return new CoercionMonitor(clock, alertDispatcher);
    }

    @Bean
    public SituationalMonitor situationalMonitor(Clock clock, AlertDispatcher alertDispatcher) {
        return new SituationalMonitor(clock, alertDispatcher);
    }

    @Bean
    public IntentCorrelator intentCorrelator(Clock clock, AlertDispatcher alertDispatcher) {
        return new IntentCorrelator(clock, alertDispatcher);
    }

    // =========================================================================
    //  Voice
    // =========================================================================

    @Bean
    public FeatureExtractor featureExtractor() {
        return new FeatureExtractor();
    }

    @Bean
    public VoiceMatcher voiceMatcher() {
        return new VoiceMatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public AudioCapture audioCapture() {
        return new UnavailableAudioCapture();
    }

    @Bean
    @ConditionalOnProperty(name = "safepulse.voiceprint.store", havingValue = "file")
    public VoiceprintRepository jsonFileVoiceprintRepository(
            @Value("${safepulse.voiceprint.directory:./voiceprints}") String directory,
            ObjectMapper objectMapper) {
        log.info("Voiceprints stored as JSON files under {}", directory);
        return new JsonFileVoiceprintRepository(Path.of(directory), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(VoiceprintRepository.class)
    public VoiceprintRepository inMemoryVoiceprintRepository() {
        return new InMemoryVoiceprintRepository();
    }

    @Bean
    public VoiceprintService voiceprintService(AudioCapture audioCapture,
                                               FeatureExtractor featureExtractor,
                                               VoiceMatcher voiceMatcher,
                                               VoiceprintRepository voiceprintRepository,
                                               Clock clock) {
        return new VoiceprintService(audioCapture, featureExtractor, voiceMatcher, voiceprintRepository, clock);
    }

    // =========================================================================
    //  Truth Lock
    // =========================================================================

    @Bean
    @ConditionalOnProperty(name = "safepulse.truth-lock.store", havingValue = "jdbc")
    public TruthLockRepository jdbcTruthLockRepository(JdbcTemplate jdbcTemplate) {
        log.info("Truth lock metadata stored through JDBC");
        return new JdbcTruthLockRepository(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(TruthLockRepository.class)
    public TruthLockRepository inMemoryTruthLockRepository() {
        return new InMemoryTruthLockRepository();
    }

    @Bean
    public TruthLockService truthLockService(TruthLockRepository truthLockRepository,
                                             EvidenceReleaseNotifier releaseNotifier,
                                             AlertDispatcher alertDispatcher,
                                             Clock clock,
                                             @Value("${safepulse.truth-lock.default-auto-release-hours:24}") int defaultAutoReleaseHours) {
        return new TruthLockService(truthLockRepository, releaseNotifier, alertDispatcher, clock, defaultAutoReleaseHours);
    }
}
