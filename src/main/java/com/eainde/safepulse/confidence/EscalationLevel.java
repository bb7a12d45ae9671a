package com.eainde.safepulse.confidence;

/**
 * An ordered escalation state. Enum declaration order is severity order, lowest first;
 * {@link #threshold()} is the inclusive minimum score for the level.
 */
public interface EscalationLevel {

    int threshold();
}
