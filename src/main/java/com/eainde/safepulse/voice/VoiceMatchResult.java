package com.eainde.safepulse.voice;

public record VoiceMatchResult(
        double similarity,
        boolean matched
) {
    public static VoiceMatchResult of(double similarity) {
        return new VoiceMatchResult(similarity, similarity >= VoiceMatcher.MATCH_THRESHOLD);
    }
}
