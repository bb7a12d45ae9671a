package com.eainde.safepulse.truthlock;

/**
 * Delivers released evidence to the user's contacts. Called once per manual or
 * deadline release, never for a cancelled lock.
 */
public interface EvidenceReleaseNotifier {

    void release(ReleaseNotice notice);
}
