package com.eainde.safepulse.voice;

import com.eainde.safepulse.error.Precondition;
import com.eainde.safepulse.error.PreconditionFailedException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One user's enrolled reference voice: exactly {@link VoiceMatcher#REQUIRED_SAMPLES}
 * feature vectors. Immutable; replaced only by a full reset and re-enrollment.
 */
public record Voiceprint(
        String userId,
        List<VoiceFeatures> samples,
        Instant createdAt
) {
    public Voiceprint {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(createdAt, "createdAt");
        if (samples == null || samples.size() != VoiceMatcher.REQUIRED_SAMPLES) {
            throw new PreconditionFailedException(Precondition.ENROLLMENT_INCOMPLETE,
                    "A voiceprint needs exactly " + VoiceMatcher.REQUIRED_SAMPLES + " samples, got "
                            + (samples == null ? 0 : samples.size()));
        }
        samples = List.copyOf(samples);
    }
}
