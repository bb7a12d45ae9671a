package com.eainde.safepulse.error;

/** Which precondition an operation failed on. */
public enum Precondition {
    NOT_LOCKED("Incident is not locked"),
    ALREADY_LOCKED("Incident is already locked"),
    ALREADY_RELEASED("Lock has already reached a terminal state"),
    CANCEL_WINDOW_EXPIRED("The cancellation window has expired"),
    INVALID_AUTO_RELEASE("Auto-release hours must be positive"),
    NO_VOICEPRINT("No voiceprint is enrolled"),
    ENROLLMENT_INCOMPLETE("Not enough enrollment samples"),
    ENROLLMENT_FULL("Enrollment already holds the required number of samples"),
    ALREADY_ENROLLED("A voiceprint is already enrolled; reset it first");

    private final String description;

    Precondition(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
