package com.eainde.safepulse.truthlock;

import com.eainde.safepulse.error.Precondition;
import com.eainde.safepulse.error.PreconditionFailedException;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Time-locked evidence vault for a single incident.
 * <p>
 * Evidence may be appended until the vault is released. Once locked, the vault can be
 * cancelled only during the first {@link #CANCEL_WINDOW}; after that only a manual
 * release or the deadline ends it. Every operation applies the deadline first, so a
 * vault whose deadline has passed is released by deadline no matter how rarely it is
 * polled.
 * </p>
 * All operations take the evaluation instant explicitly and are serialized on the vault.
 */
@Log4j2
public class TruthLock {

    public static final Duration CANCEL_WINDOW = Duration.ofMinutes(10);

    private final String incidentId;
    private final TruthLockListener listener;
    private final List<EvidenceItem> evidence = new ArrayList<>();

    private String lockId;
    private Instant lockedAt;
    private Instant unlockDeadline;
    private int autoReleaseHours;
    private String evidenceHash;
    private ReleaseOutcome outcome;
    private Instant releasedAt;

    public TruthLock(String incidentId, TruthLockListener listener) {
        this.incidentId = Objects.requireNonNull(incidentId, "incidentId");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Rebuilds a vault from persisted metadata. The deadline is not applied here; the
     * next operation or tick releases an overdue vault.
     */
    public static TruthLock restore(LockRecord record, TruthLockListener listener) {
        if (record.released()) {
            throw new IllegalArgumentException("Lock " + record.lockId() + " is already released");
        }
        TruthLock lock = new TruthLock(record.incidentId(), listener);
        lock.lockId = record.lockId();
        lock.lockedAt = record.lockedAt();
        lock.unlockDeadline = record.unlockDeadline();
        lock.autoReleaseHours = record.autoReleaseHours();
        lock.evidenceHash = record.evidenceHash();
        return lock;
    }

    /**
     * Seals the vault: the deadline becomes {@code now + autoReleaseHours} and the hash of the
     * evidence gathered so far is recorded.
     */
    public synchronized LockRecord lockIncident(int autoReleaseHours, Instant now) {
        if (autoReleaseHours <= 0) {
            throw new PreconditionFailedException(Precondition.INVALID_AUTO_RELEASE,
                    "Auto-release hours must be positive, got " + autoReleaseHours);
        }
        applyDeadline(now);
        ensureNotReleased();
        if (lockId != null) {
            throw new PreconditionFailedException(Precondition.ALREADY_LOCKED);
        }
        this.lockId = UUID.randomUUID().toString();
        this.lockedAt = now;
        this.unlockDeadline = now.plus(Duration.ofHours(autoReleaseHours));
        this.autoReleaseHours = autoReleaseHours;
        this.evidenceHash = EvidenceHasher.snapshotHash(evidence);
        log.info("Incident {} sealed as lock {} with {} evidence items, auto-release at {}",
                incidentId, lockId, evidence.size(), unlockDeadline);
        return toRecord();
    }

    /**
     * Reverts {@link #lockIncident} when its metadata could not be persisted. A no-op unless
     * the vault is still sealed under {@code expectedLockId} and not yet released.
     */
    synchronized void unseal(String expectedLockId) {
        if (outcome != null || lockId == null || !lockId.equals(expectedLockId)) {
            return;
        }
        log.warn("Lock {} for incident {} rolled back", lockId, incidentId);
        this.lockId = null;
        this.lockedAt = null;
        this.unlockDeadline = null;
        this.autoReleaseHours = 0;
        this.evidenceHash = null;
    }

    public synchronized EvidenceItem addEvidence(String type, String payload, Instant now) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Evidence type is required");
        }
        Objects.requireNonNull(payload, "payload");
        applyDeadline(now);
        ensureNotReleased();
        EvidenceItem item = EvidenceItem.of(type, payload, now);
        evidence.add(item);
        log.debug("Evidence added to incident {}: {}", incidentId, type);
        return item;
    }

    /**
     * Calls the incident off. Allowed only while {@code now - lockedAt} is strictly below
     * the cancel window.
     */
    public synchronized void cancelLock(Instant now) {
        applyDeadline(now);
        ensureNotReleased();
        ensureLocked();
        if (!withinCancelWindow(now)) {
            throw new PreconditionFailedException(Precondition.CANCEL_WINDOW_EXPIRED);
        }
        release(ReleaseOutcome.CANCELLED, now);
    }

    public synchronized void releaseEvidence(Instant now) {
        applyDeadline(now);
        ensureNotReleased();
        ensureLocked();
        release(ReleaseOutcome.MANUAL, now);
    }

    /**
     * Releases the vault if its deadline has passed.
     *
     * @return true if this call performed the release
     */
    public synchronized boolean checkDeadline(Instant now) {
        return applyDeadline(now);
    }

    public synchronized TruthLockPhase phase(Instant now) {
        applyDeadline(now);
        if (outcome != null) {
            return outcome.phase();
        }
        if (lockId == null) {
            return TruthLockPhase.UNLOCKED;
        }
        return withinCancelWindow(now) ? TruthLockPhase.LOCKED_CANCELLABLE : TruthLockPhase.LOCKED_FINAL;
    }

    public boolean canCancel(Instant now) {
        return phase(now) == TruthLockPhase.LOCKED_CANCELLABLE;
    }

    /** Time left before auto-release; zero unless the vault is locked. */
    public synchronized Duration remaining(Instant now) {
        if (!phase(now).isLocked()) {
            return Duration.ZERO;
        }
        return Duration.between(now, unlockDeadline);
    }

    /** Countdown rendered as {@code "{h}h {m}m {s}s"}; empty unless the vault is locked. */
    public synchronized String timeRemaining(Instant now) {
        if (!phase(now).isLocked()) {
            return "";
        }
        return format(remaining(now));
    }

    public static String format(Duration remaining) {
        long seconds = Math.max(0, remaining.getSeconds());
        return (seconds / 3600) + "h " + (seconds % 3600 / 60) + "m " + (seconds % 60) + "s";
    }

    public String incidentId() {
        return incidentId;
    }

    public synchronized Optional<String> lockId() {
        return Optional.ofNullable(lockId);
    }

    public synchronized List<EvidenceItem> evidence() {
        return List.copyOf(evidence);
    }

    public synchronized Optional<LockRecord> record() {
        return lockId == null ? Optional.empty() : Optional.of(toRecord());
    }

    private boolean applyDeadline(Instant now) {
        if (lockId == null || outcome != null || now.isBefore(unlockDeadline)) {
            return false;
        }
        log.warn("Deadline reached for lock {} (incident {}), releasing evidence", lockId, incidentId);
        release(ReleaseOutcome.DEADLINE, now);
        return true;
    }

    private void release(ReleaseOutcome releaseOutcome, Instant now) {
        this.outcome = releaseOutcome;
        this.releasedAt = now;
        log.info("Lock {} for incident {} released: {}", lockId, incidentId, releaseOutcome);
        listener.onReleased(new ReleaseNotice(lockId, incidentId, releaseOutcome, now, evidenceHash, evidence));
    }

    private boolean withinCancelWindow(Instant now) {
        return Duration.between(lockedAt, now).compareTo(CANCEL_WINDOW) < 0;
    }

    private void ensureLocked() {
        if (lockId == null) {
            throw new PreconditionFailedException(Precondition.NOT_LOCKED);
        }
    }

    private void ensureNotReleased() {
        if (outcome != null) {
            throw new PreconditionFailedException(Precondition.ALREADY_RELEASED,
                    "Lock " + lockId + " was already released: " + outcome);
        }
    }

    private LockRecord toRecord() {
        return new LockRecord(lockId, incidentId, lockedAt, unlockDeadline, autoReleaseHours,
                evidenceHash, outcome != null, releasedAt, outcome);
    }
}
