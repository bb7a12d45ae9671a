package com.eainde.safepulse.capture;

import com.eainde.safepulse.signal.DangerSignalKind;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores a final speech transcript by how many distinct distress words it contains.
 * Matching is by substring, so "helpless" counts as "help".
 */
public class DistressPhraseScorer {

    static final List<String> DISTRESS_WORDS =
            List.of("help", "stop", "no", "please", "emergency", "scared", "danger", "hurt");
    static final double VALUE_PER_WORD = 40;

    public Optional<DetectedSignal<DangerSignalKind>> score(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return Optional.empty();
        }
        String text = transcript.toLowerCase(Locale.ROOT);
        long count = DISTRESS_WORDS.stream().filter(text::contains).count();
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(new DetectedSignal<>(DangerSignalKind.VOICE, Math.min(100, count * VALUE_PER_WORD),
                "Detected distress indicators: " + count + " keywords"));
    }
}
