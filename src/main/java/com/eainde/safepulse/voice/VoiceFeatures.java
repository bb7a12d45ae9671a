package com.eainde.safepulse.voice;

import com.eainde.safepulse.error.InvalidSignalException;

import java.util.Arrays;

/**
 * Fixed feature vector of one utterance. Produced once per enrollment sample or
 * verification attempt and never mutated.
 */
public record VoiceFeatures(
        double[] mfcc,
        double pitch,
        double energy,
        double spectralCentroid,
        double zeroCrossingRate
) {
    public VoiceFeatures {
        if (mfcc == null || mfcc.length != FeatureExtractor.MFCC_BINS) {
            throw new InvalidSignalException("MFCC vector must have " + FeatureExtractor.MFCC_BINS + " bins");
        }
        mfcc = mfcc.clone();
    }

    @Override
    public double[] mfcc() {
        return mfcc.clone();
    }

    double mfccAt(int bin) {
        return mfcc[bin];
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof VoiceFeatures that
                && Arrays.equals(mfcc, that.mfcc)
                && Double.compare(pitch, that.pitch) == 0
                && Double.compare(energy, that.energy) == 0
                && Double.compare(spectralCentroid, that.spectralCentroid) == 0
                && Double.compare(zeroCrossingRate, that.zeroCrossingRate) == 0;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(mfcc);
        result = 31 * result + Double.hashCode(pitch);
        result = 31 * result + Double.hashCode(energy);
        result = 31 * result + Double.hashCode(spectralCentroid);
        result = 31 * result + Double.hashCode(zeroCrossingRate);
        return result;
    }

    @Override
    public String toString() {
        return "VoiceFeatures[pitch=" + pitch + ", energy=" + energy + ", centroid=" + spectralCentroid
                + ", zcr=" + zeroCrossingRate + ", mfcc=" + Arrays.toString(mfcc) + "]";
    }
}
