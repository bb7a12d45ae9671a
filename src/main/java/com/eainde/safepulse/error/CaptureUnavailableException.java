package com.eainde.safepulse.error;

/** A capture collaborator could not supply a sample. The core does not retry. */
public class CaptureUnavailableException extends RuntimeException {

    public CaptureUnavailableException(String message) {
        super(message);
    }

    public CaptureUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
