package com.eainde.safepulse.voice;

import com.eainde.safepulse.error.CaptureUnavailableException;
import com.eainde.safepulse.error.Precondition;
import com.eainde.safepulse.error.PreconditionFailedException;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Voiceprint enrollment and verification per user.
 * <p>
 * Enrollment collects exactly {@link VoiceMatcher#REQUIRED_SAMPLES} samples and is then
 * finalized in one step; there are no partial updates. Calls for the same user are
 * serialized, so two concurrent finalizations cannot both succeed.
 * </p>
 */
@Log4j2
public class VoiceprintService {

    private final AudioCapture audioCapture;
    private final FeatureExtractor featureExtractor;
    private final VoiceMatcher voiceMatcher;
    private final VoiceprintRepository repository;
    private final Clock clock;

    private final Map<String, Enrollment> enrollments = new ConcurrentHashMap<>();

    public VoiceprintService(AudioCapture audioCapture,
                             FeatureExtractor featureExtractor,
                             VoiceMatcher voiceMatcher,
                             VoiceprintRepository repository,
                             Clock clock) {
        this.audioCapture = audioCapture;
        this.featureExtractor = featureExtractor;
        this.voiceMatcher = voiceMatcher;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Captures one utterance through the capture collaborator and adds its features to the
     * user's pending enrollment.
     *
     * @throws CaptureUnavailableException if the collaborator cannot supply audio
     * @throws PreconditionFailedException {@code ALREADY_ENROLLED} or {@code ENROLLMENT_FULL}
     */
    public VoiceFeatures recordSample(String userId) {
        Enrollment enrollment = enrollmentFor(userId);
        synchronized (enrollment) {
            ensureNotEnrolled(userId, enrollment);
            if (enrollment.pending.size() >= VoiceMatcher.REQUIRED_SAMPLES) {
                throw new PreconditionFailedException(Precondition.ENROLLMENT_FULL);
            }
            AudioSample sample = audioCapture.capture();
            VoiceFeatures features = featureExtractor.extract(sample);
            enrollment.pending.add(features);
            log.info("Voice sample {}/{} recorded for user {}",
                    enrollment.pending.size(), VoiceMatcher.REQUIRED_SAMPLES, userId);
            return features;
        }
    }

    /**
     * Finalizes the pending samples into a stored voiceprint.
     *
     * @throws PreconditionFailedException {@code ENROLLMENT_INCOMPLETE} with fewer than the
     *                                     required samples, {@code ALREADY_ENROLLED} if finalized before
     */
    public Voiceprint createVoiceprint(String userId) {
        Enrollment enrollment = enrollmentFor(userId);
        synchronized (enrollment) {
            ensureNotEnrolled(userId, enrollment);
            int missing = VoiceMatcher.REQUIRED_SAMPLES - enrollment.pending.size();
            if (missing > 0) {
                throw new PreconditionFailedException(Precondition.ENROLLMENT_INCOMPLETE,
                        "Record " + missing + " more samples");
            }
            Voiceprint voiceprint = voiceMatcher.createVoiceprint(userId, enrollment.pending, clock.instant());
            repository.save(voiceprint);
            enrollment.voiceprint = voiceprint;
            enrollment.pending.clear();
            log.info("Voiceprint created for user {} from {} samples", userId, voiceprint.samples().size());
            return voiceprint;
        }
    }

    /**
     * Compares a probe utterance against the user's voiceprint.
     *
     * @throws PreconditionFailedException {@code NO_VOICEPRINT} if the user has not enrolled
     */
    public VoiceMatchResult matchVoice(String userId, AudioSample probe) {
        Voiceprint voiceprint = findVoiceprint(userId)
                .orElseThrow(() -> new PreconditionFailedException(Precondition.NO_VOICEPRINT));
        VoiceMatchResult result = voiceMatcher.matchVoice(featureExtractor.extract(probe), voiceprint);
        log.info("Voice match confidence for user {}: {}%", userId, String.format("%.1f", result.similarity() * 100));
        return result;
    }

    /** Captures a probe through the capture collaborator and matches it. */
    public VoiceMatchResult verify(String userId) {
        findVoiceprint(userId).orElseThrow(() -> new PreconditionFailedException(Precondition.NO_VOICEPRINT));
        return matchVoice(userId, audioCapture.capture());
    }

    public Optional<Voiceprint> findVoiceprint(String userId) {
        Enrollment enrollment = enrollmentFor(userId);
        synchronized (enrollment) {
            return Optional.ofNullable(loadedVoiceprint(userId, enrollment));
        }
    }

    public int pendingSamples(String userId) {
        Enrollment enrollment = enrollmentFor(userId);
        synchronized (enrollment) {
            return enrollment.pending.size();
        }
    }

    /** Discards pending samples and the stored voiceprint. */
    public void resetVoiceprint(String userId) {
        Enrollment enrollment = enrollmentFor(userId);
        synchronized (enrollment) {
            enrollment.pending.clear();
            enrollment.voiceprint = null;
            enrollment.loaded = true;
            repository.delete(userId);
            log.info("Voiceprint reset for user {}", userId);
        }
    }

    private void ensureNotEnrolled(String userId, Enrollment enrollment) {
        if (loadedVoiceprint(userId, enrollment) != null) {
            throw new PreconditionFailedException(Precondition.ALREADY_ENROLLED);
        }
    }

    private Voiceprint loadedVoiceprint(String userId, Enrollment enrollment) {
        if (!enrollment.loaded) {
            enrollment.voiceprint = repository.findByUserId(userId).orElse(null);
            enrollment.loaded = true;
            if (enrollment.voiceprint != null) {
                log.info("Voiceprint loaded from storage for user {}", userId);
            }
        }
        return enrollment.voiceprint;
    }

    private Enrollment enrollmentFor(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return enrollments.computeIfAbsent(userId, k -> new Enrollment());
    }

    private static final class Enrollment {
        private final List<VoiceFeatures> pending = new ArrayList<>();
        private Voiceprint voiceprint;
        private boolean loaded;
    }
}
