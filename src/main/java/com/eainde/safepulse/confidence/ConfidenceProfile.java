package com.eainde.safepulse.confidence;

import com.eainde.safepulse.signal.SafetyDomain;
import com.eainde.safepulse.signal.SignalKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed scoring constants of one domain.
 *
 * @param domain     owning domain
 * @param kindType   closed set of signal kinds, each carrying its weight
 * @param levelType  ordered escalation levels with their score thresholds
 * @param halfLife   age at which a signal's contribution has faded to zero
 * @param normalizer divisor keeping a single strong signal from saturating the score
 * @param capacity   history size before FIFO eviction
 */
public record ConfidenceProfile<K extends Enum<K> & SignalKind, L extends Enum<L> & EscalationLevel>(
        SafetyDomain domain,
        Class<K> kindType,
        Class<L> levelType,
        Duration halfLife,
        double normalizer,
        int capacity
) {
    public ConfidenceProfile {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(kindType, "kindType");
        Objects.requireNonNull(levelType, "levelType");
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("halfLife must be positive");
        }
        if (normalizer <= 0) {
            throw new IllegalArgumentException("normalizer must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
    }

    public L lowestLevel() {
        return EscalationLevels.lowest(levelType);
    }

    public L highestLevel() {
        return EscalationLevels.highest(levelType);
    }

    public L levelFor(int score) {
        return EscalationLevels.levelFor(levelType, score);
    }
}
