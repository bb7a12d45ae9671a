package com.eainde.safepulse.voice;

import java.time.Instant;
import java.util.List;

/**
 * Weighted similarity between feature vectors and voiceprint matching.
 * <p>
 * A probe is compared with every reference and the similarities are averaged, so an
 * inconsistent enrollment lowers the score instead of a single lucky reference raising it.
 * </p>
 */
public class VoiceMatcher {

    public static final int REQUIRED_SAMPLES = 5;
    public static final double MATCH_THRESHOLD = 0.75;

    /** Similarity reported against an empty reference set: no data is neither match nor mismatch. */
    public static final double NEUTRAL_SIMILARITY = 0.5;

    private static final double MFCC_WEIGHT = 0.4;
    private static final double PITCH_WEIGHT = 0.25;
    private static final double ENERGY_WEIGHT = 0.15;
    private static final double CENTROID_WEIGHT = 0.1;
    private static final double ZCR_WEIGHT = 0.1;
    private static final double TOTAL_WEIGHT = MFCC_WEIGHT + PITCH_WEIGHT + ENERGY_WEIGHT + CENTROID_WEIGHT + ZCR_WEIGHT;

    /** 0-1 similarity of two feature vectors; 1 for identical vectors. */
    public double compare(VoiceFeatures a, VoiceFeatures b) {
        double mfccSimilarity = 0;
        for (int bin = 0; bin < FeatureExtractor.MFCC_BINS; bin++) {
            mfccSimilarity += inverse(Math.abs(a.mfccAt(bin) - b.mfccAt(bin)));
        }
        mfccSimilarity /= FeatureExtractor.MFCC_BINS;

        double similarity = mfccSimilarity * MFCC_WEIGHT
                + inverse(Math.abs(a.pitch() - b.pitch()) / 100) * PITCH_WEIGHT
                + inverse(Math.abs(a.energy() - b.energy()) * 10) * ENERGY_WEIGHT
                + inverse(Math.abs(a.spectralCentroid() - b.spectralCentroid()) / 100) * CENTROID_WEIGHT
                + inverse(Math.abs(a.zeroCrossingRate() - b.zeroCrossingRate()) * 100) * ZCR_WEIGHT;
        return similarity / TOTAL_WEIGHT;
    }

    public double averageSimilarity(VoiceFeatures probe, List<VoiceFeatures> references) {
        if (references.isEmpty()) {
            return NEUTRAL_SIMILARITY;
        }
        double sum = 0;
        for (VoiceFeatures reference : references) {
            sum += compare(probe, reference);
        }
        return sum / references.size();
    }

    public Voiceprint createVoiceprint(String userId, List<VoiceFeatures> samples, Instant createdAt) {
        return new Voiceprint(userId, samples, createdAt);
    }

    public VoiceMatchResult matchVoice(VoiceFeatures probe, Voiceprint voiceprint) {
        return VoiceMatchResult.of(averageSimilarity(probe, voiceprint.samples()));
    }

    private static double inverse(double distance) {
        return 1 / (1 + distance);
    }
}
