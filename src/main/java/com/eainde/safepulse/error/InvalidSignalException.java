package com.eainde.safepulse.error;

/**
 * Rejected input: unknown kind, negative or non-finite value, confidence out of range,
 * malformed audio buffer. The receiving component's state is left unchanged.
 */
public class InvalidSignalException extends IllegalArgumentException {

    public InvalidSignalException(String message) {
        super(message);
    }
}
