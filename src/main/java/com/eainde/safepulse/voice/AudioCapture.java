package com.eainde.safepulse.voice;

import com.eainde.safepulse.error.CaptureUnavailableException;

/**
 * Platform capture collaborator. Records one short utterance and returns it already
 * decoded to time-domain samples.
 */
@FunctionalInterface
public interface AudioCapture {

    AudioSample capture() throws CaptureUnavailableException;
}
