package com.eainde.safepulse.voice;

import com.eainde.safepulse.error.Precondition;
import com.eainde.safepulse.error.PreconditionFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VoiceMatcherTest {

    private static final Instant NOW = Instant.parse("2025-02-02T10:00:00Z");

    private final VoiceMatcher matcher = new VoiceMatcher();

    private final VoiceFeatures reference = Signals.features(1.0, 200, 0.3, 500, 0.05);

    @Test
    @DisplayName("identical vectors should score 1")
    void identical() {
        assertThat(matcher.compare(reference, reference)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("slightly perturbed vectors should match")
    void nearIdentical() {
        VoiceFeatures probe = Signals.features(1.05, 205, 0.31, 505, 0.051);

        assertThat(matcher.compare(reference, probe)).isGreaterThanOrEqualTo(VoiceMatcher.MATCH_THRESHOLD);
    }

    @Test
    @DisplayName("a very different voice should not match")
    void different() {
        VoiceFeatures stranger = Signals.features(4.0, 600, 0.9, 900, 0.4);

        assertThat(matcher.compare(reference, stranger)).isLessThan(VoiceMatcher.MATCH_THRESHOLD);
        assertThat(matcher.matchVoice(stranger, voiceprintOf(reference)).matched()).isFalse();
    }

    @Test
    @DisplayName("comparison should be symmetric")
    void symmetric() {
        VoiceFeatures other = Signals.features(2.0, 300, 0.5, 700, 0.1);

        assertThat(matcher.compare(reference, other)).isEqualTo(matcher.compare(other, reference));
    }

    @Test
    @DisplayName("an empty reference set should give the neutral similarity")
    void emptyReferences() {
        assertThat(matcher.averageSimilarity(reference, List.of())).isEqualTo(VoiceMatcher.NEUTRAL_SIMILARITY);
    }

    @Test
    @DisplayName("matching should average over every reference")
    void averages() {
        VoiceFeatures stranger = Signals.features(4.0, 600, 0.9, 900, 0.4);
        double expected = (matcher.compare(reference, reference) * 4 + matcher.compare(reference, stranger)) / 5;

        VoiceMatchResult result = matcher.matchVoice(reference,
                new Voiceprint("u1", List.of(reference, reference, reference, reference, stranger), NOW));

        assertThat(result.similarity()).isCloseTo(expected, within(1e-12));
    }

    @Test
    @DisplayName("a voiceprint needs exactly five samples")
    void voiceprintSize() {
        assertThatThrownBy(() -> matcher.createVoiceprint("u1", Collections.nCopies(4, reference), NOW))
                .isInstanceOfSatisfying(PreconditionFailedException.class,
                        e -> assertThat(e.getPrecondition()).isEqualTo(Precondition.ENROLLMENT_INCOMPLETE));
    }

    private static Voiceprint voiceprintOf(VoiceFeatures features) {
        return new Voiceprint("u1", Collections.nCopies(VoiceMatcher.REQUIRED_SAMPLES, features), NOW);
    }
}
