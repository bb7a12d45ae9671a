package com.eainde.safepulse.voice;

import com.eainde.safepulse.error.CaptureUnavailableException;

/** Used when the host registers no microphone collaborator. */
public class UnavailableAudioCapture implements AudioCapture {

    @Override
    public AudioSample capture() {
        throw new CaptureUnavailableException("No audio capture collaborator is configured");
    }
}
