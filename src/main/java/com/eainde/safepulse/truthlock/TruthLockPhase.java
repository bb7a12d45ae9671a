package com.eainde.safepulse.truthlock;

public enum TruthLockPhase {
    UNLOCKED,
    LOCKED_CANCELLABLE,
    LOCKED_FINAL,
    RELEASED_BY_CANCEL,
    RELEASED_MANUALLY,
    RELEASED_BY_DEADLINE;

    public boolean isLocked() {
        return this == LOCKED_CANCELLABLE || this == LOCKED_FINAL;
    }

    public boolean isTerminal() {
        return this == RELEASED_BY_CANCEL || this == RELEASED_MANUALLY || this == RELEASED_BY_DEADLINE;
    }
}
