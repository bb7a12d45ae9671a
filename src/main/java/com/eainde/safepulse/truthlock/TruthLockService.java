package com.eainde.safepulse.truthlock;

import com.eainde.safepulse.alert.AlertDispatcher;
import com.eainde.safepulse.error.Precondition;
import com.eainde.safepulse.error.PreconditionFailedException;
import jakarta.annotation.PostConstruct;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one {@link TruthLock} per incident, persists lock metadata and drives the
 * deadline check on a fixed schedule.
 * <p>
 * Released vaults leave the active set and are kept in a bounded cache of the most
 * recent {@value #RELEASED_CACHE_SIZE} releases, so status queries and repeated release
 * attempts still see the terminal phase. Queries never create a vault.
 * </p>
 */
@Log4j2
public class TruthLockService {

    static final String DISPATCH_DOMAIN = "TRUTH_LOCK";
    static final int RELEASED_CACHE_SIZE = 256;

    private final TruthLockRepository repository;
    private final EvidenceReleaseNotifier releaseNotifier;
    private final AlertDispatcher dispatcher;
    private final Clock clock;
    private final int defaultAutoReleaseHours;

    private final Map<String, TruthLock> vaults = new ConcurrentHashMap<>();
    private final Map<String, TruthLock> released = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, TruthLock> eldest) {
                    return size() > RELEASED_CACHE_SIZE;
                }
            });

    public TruthLockService(TruthLockRepository repository,
                            EvidenceReleaseNotifier releaseNotifier,
                            AlertDispatcher dispatcher,
                            Clock clock,
                            int defaultAutoReleaseHours) {
        this.repository = repository;
        this.releaseNotifier = releaseNotifier;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.defaultAutoReleaseHours = defaultAutoReleaseHours;
    }

    /** Reloads unreleased locks so an overdue deadline still fires after a restart. */
    @PostConstruct
    public void restoreUnreleasedLocks() {
        List<LockRecord> unreleased = repository.findUnreleased();
        for (LockRecord record : unreleased) {
            vaults.put(record.incidentId(), TruthLock.restore(record, this::onReleased));
        }
        if (!unreleased.isEmpty()) {
            log.info("Restored {} unreleased truth locks", unreleased.size());
        }
        checkDeadlines();
    }

    public LockRecord lockIncident(String incidentId) {
        return lockIncident(incidentId, defaultAutoReleaseHours);
    }

    /**
     * Seals the incident's vault and persists the lock. If the lock cannot be persisted
     * the vault is unsealed again and the failure is rethrown.
     */
    public LockRecord lockIncident(String incidentId, int autoReleaseHours) {
        TruthLock lock = vault(incidentId);
        LockRecord record = lock.lockIncident(autoReleaseHours, clock.instant());
        try {
            repository.save(record);
        } catch (RuntimeException e) {
            log.error("Could not persist lock {} for incident {}", record.lockId(), incidentId, e);
            lock.unseal(record.lockId());
            throw e;
        }
        return record;
    }

    public EvidenceItem addEvidence(String incidentId, String type, String payload) {
        return vault(incidentId).addEvidence(type, payload, clock.instant());
    }

    public void cancelLock(String incidentId) {
        existing(incidentId).cancelLock(clock.instant());
    }

    public void releaseEvidence(String incidentId) {
        existing(incidentId).releaseEvidence(clock.instant());
    }

    public TruthLockStatus status(String incidentId) {
        Instant now = clock.instant();
        Optional<TruthLock> found = find(incidentId);
        if (found.isEmpty()) {
            return new TruthLockStatus(incidentId, null, TruthLockPhase.UNLOCKED, false, null, "", 0, now);
        }
        TruthLock lock = found.get();
        TruthLockPhase phase = lock.phase(now);
        Optional<LockRecord> record = lock.record();
        return new TruthLockStatus(
                incidentId,
                record.map(LockRecord::lockId).orElse(null),
                phase,
                phase == TruthLockPhase.LOCKED_CANCELLABLE,
                record.map(LockRecord::unlockDeadline).orElse(null),
                lock.timeRemaining(now),
                lock.evidence().size(),
                now);
    }

    public Optional<TruthLock> find(String incidentId) {
        if (incidentId == null) {
            return Optional.empty();
        }
        TruthLock active = vaults.get(incidentId);
        return active != null ? Optional.of(active) : Optional.ofNullable(released.get(incidentId));
    }

    /** Number of vaults still awaiting a terminal outcome. */
    public int activeCount() {
        return vaults.size();
    }

    /**
     * Applies the deadline to every active vault.
     *
     * @return number of vaults released by this pass
     */
    @Scheduled(fixedDelayString = "${safepulse.truth-lock.deadline-check-interval-ms:1000}")
    public int checkDeadlines() {
        Instant now = clock.instant();
        int releasedCount = 0;
        for (TruthLock lock : List.copyOf(vaults.values())) {
            try {
                if (lock.checkDeadline(now)) {
                    releasedCount++;
                }
            } catch (RuntimeException e) {
                log.error("Deadline check failed for incident {}", lock.incidentId(), e);
            }
        }
        return releasedCount;
    }

    private TruthLock vault(String incidentId) {
        requireId(incidentId);
        TruthLock terminal = released.get(incidentId);
        if (terminal != null) {
            return terminal;
        }
        return vaults.computeIfAbsent(incidentId, id -> new TruthLock(id, this::onReleased));
    }

    private TruthLock existing(String incidentId) {
        requireId(incidentId);
        return find(incidentId).orElseThrow(() -> new PreconditionFailedException(Precondition.NOT_LOCKED,
                "No lock exists for incident " + incidentId));
    }

    private static void requireId(String incidentId) {
        if (incidentId == null || incidentId.isBlank()) {
            throw new IllegalArgumentException("incidentId is required");
        }
    }

    private void onReleased(ReleaseNotice notice) {
        TruthLock lock = vaults.remove(notice.incidentId());
        if (lock != null) {
            released.put(notice.incidentId(), lock);
        }
        try {
            repository.markReleased(notice.lockId(), notice.outcome(), notice.releasedAt());
        } catch (RuntimeException e) {
            // the release stands; an unpersisted one is replayed by the next restore
            log.error("Could not persist release of lock {} ({})", notice.lockId(), notice.outcome(), e);
        }
        if (!notice.outcome().notifiesContacts()) {
            log.info("Lock {} cancelled, evidence kept local", notice.lockId());
            return;
        }
        MDC.put("lockId", notice.lockId());
        try {
            dispatcher.dispatch(DISPATCH_DOMAIN, "evidence release", () -> releaseNotifier.release(notice));
        } finally {
            MDC.remove("lockId");
        }
    }
}
