package com.eainde.safepulse.voice;

/**
 * Cheap time-domain voice features. No FFT: the spectral centroid is approximated by
 * the index-weighted centroid of sample magnitudes and the MFCC vector by per-bin mean
 * log-magnitude over equal partitions of the buffer.
 */
public class FeatureExtractor {

    public static final int MFCC_BINS = 13;
    static final int MIN_PITCH_LAG = 20;
    static final int MAX_PITCH_LAG = 500;

    public VoiceFeatures extract(AudioSample sample) {
        return new VoiceFeatures(
                mfcc(sample),
                pitch(sample),
                energy(sample),
                spectralCentroid(sample),
                zeroCrossingRate(sample));
    }

    /** Root mean square of the normalized samples. */
    static double energy(AudioSample sample) {
        double sumOfSquares = 0;
        for (int i = 0; i < sample.length(); i++) {
            double value = sample.get(i);
            sumOfSquares += value * value;
        }
        return Math.sqrt(sumOfSquares / sample.length());
    }

    /** Sign changes per sample; zero counts as positive. */
    static double zeroCrossingRate(AudioSample sample) {
        int crossings = 0;
        for (int i = 1; i < sample.length(); i++) {
            boolean current = sample.get(i) >= 0;
            boolean previous = sample.get(i - 1) >= 0;
            if (current != previous) {
                crossings++;
            }
        }
        return (double) crossings / sample.length();
    }

    static double spectralCentroid(AudioSample sample) {
        double weightedSum = 0;
        double totalSum = 0;
        for (int i = 0; i < sample.length(); i++) {
            double magnitude = Math.abs(sample.get(i));
            weightedSum += i * magnitude;
            totalSum += magnitude;
        }
        return totalSum > 0 ? weightedSum / totalSum : 0;
    }

    /**
     * Autocorrelation peak over lags [20, 500) bounded by half the buffer, as Hz.
     * Zero when no lag correlates positively.
     */
    static double pitch(AudioSample sample) {
        int length = sample.length();
        double maxCorrelation = 0;
        double pitch = 0;
        for (int lag = MIN_PITCH_LAG; lag < MAX_PITCH_LAG && lag < length / 2; lag++) {
            double correlation = 0;
            for (int i = 0; i < length - lag; i++) {
                correlation += sample.get(i) * sample.get(i + lag);
            }
            if (correlation > maxCorrelation) {
                maxCorrelation = correlation;
                pitch = (double) sample.sampleRate() / lag;
            }
        }
        return pitch;
    }

    static double[] mfcc(AudioSample sample) {
        double[] bins = new double[MFCC_BINS];
        int binSize = sample.length() / MFCC_BINS;
        for (int bin = 0; bin < MFCC_BINS; bin++) {
            double binEnergy = 0;
            for (int j = bin * binSize; j < (bin + 1) * binSize; j++) {
                binEnergy += Math.abs(sample.get(j));
            }
            bins[bin] = Math.log(1 + binEnergy / binSize);
        }
        return bins;
    }
}
