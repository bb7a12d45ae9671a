package com.eainde.safepulse.truthlock;

/** The three mutually exclusive ways a lock reaches a terminal state. */
public enum ReleaseOutcome {
    CANCELLED(TruthLockPhase.RELEASED_BY_CANCEL, false),
    MANUAL(TruthLockPhase.RELEASED_MANUALLY, true),
    DEADLINE(TruthLockPhase.RELEASED_BY_DEADLINE, true);

    private final TruthLockPhase phase;
    private final boolean notifiesContacts;

    ReleaseOutcome(TruthLockPhase phase, boolean notifiesContacts) {
        this.phase = phase;
        this.notifiesContacts = notifiesContacts;
    }

    public TruthLockPhase phase() {
        return phase;
    }

    /** Cancellation calls the incident off, so the evidence is not sent anywhere. */
    public boolean notifiesContacts() {
        return notifiesContacts;
    }
}
