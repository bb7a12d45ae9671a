package com.eainde.safepulse.truthlock;

/** Invoked synchronously, while the vault is still held, when a lock becomes terminal. */
@FunctionalInterface
public interface TruthLockListener {

    void onReleased(ReleaseNotice notice);
}
