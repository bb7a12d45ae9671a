package com.eainde.safepulse.voice;

import com.eainde.safepulse.error.InvalidSignalException;

/**
 * A mono time-domain buffer already captured by the platform, samples normalized to [-1, 1].
 */
public final class AudioSample {

    /** Smallest buffer that still fills every MFCC bin with at least one sample. */
    public static final int MIN_LENGTH = FeatureExtractor.MFCC_BINS;

    private final float[] samples;
    private final int sampleRate;

    private AudioSample(float[] samples, int sampleRate) {
        if (samples == null || samples.length < MIN_LENGTH) {
            throw new InvalidSignalException("Audio buffer must hold at least " + MIN_LENGTH + " samples");
        }
        if (sampleRate <= 0) {
            throw new InvalidSignalException("Sample rate must be positive: " + sampleRate);
        }
        this.samples = samples;
        this.sampleRate = sampleRate;
    }

    public static AudioSample ofNormalized(float[] samples, int sampleRate) {
        return new AudioSample(samples != null ? samples.clone() : null, sampleRate);
    }

    /** Converts signed 16-bit PCM to normalized floats. */
    public static AudioSample ofPcm16(short[] pcm, int sampleRate) {
        if (pcm == null) {
            throw new InvalidSignalException("Audio buffer is required");
        }
        float[] normalized = new float[pcm.length];
        for (int i = 0; i < pcm.length; i++) {
            normalized[i] = pcm[i] / 32768f;
        }
        return new AudioSample(normalized, sampleRate);
    }

    public int length() {
        return samples.length;
    }

    public float get(int index) {
        return samples[index];
    }

    public int sampleRate() {
        return sampleRate;
    }
}
