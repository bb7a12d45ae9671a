package com.eainde.safepulse.truthlock;

import com.eainde.safepulse.MutableClock;
import com.eainde.safepulse.alert.AlertDispatcher;
import com.eainde.safepulse.alert.AlertNotifier;
import com.eainde.safepulse.alert.IncidentResponder;
import com.eainde.safepulse.error.Precondition;
import com.eainde.safepulse.error.PreconditionFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TruthLockServiceTest {

    @Mock
    private EvidenceReleaseNotifier releaseNotifier;

    @Mock
    private AlertNotifier alertNotifier;

    @Mock
    private IncidentResponder incidentResponder;

    private MutableClock clock;
    private FlakyRepository repository;
    private AlertDispatcher dispatcher;
    private TruthLockService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-07-01T22:00:00Z");
        repository = new FlakyRepository();
        dispatcher = new AlertDispatcher(alertNotifier, incidentResponder, Runnable::run);
        service = new TruthLockService(repository, releaseNotifier, dispatcher, clock, 24);
    }

    @Test
    @DisplayName("locking should persist metadata with the default auto-release")
    void lockPersists() {
        service.addEvidence("inc-1", "audio", "clip");

        LockRecord record = service.lockIncident("inc-1");

        assertThat(record.autoReleaseHours()).isEqualTo(24);
        assertThat(repository.findUnreleased()).containsExactly(record);
        TruthLockStatus status = service.status("inc-1");
        assertThat(status.isLocked()).isTrue();
        assertThat(status.canCancel()).isTrue();
        assertThat(status.timeRemaining()).isEqualTo("24h 0m 0s");
        assertThat(status.evidenceCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("the scheduled check should release overdue locks and notify once")
    void scheduledRelease() {
        service.lockIncident("inc-1", 1);
        clock.advance(Duration.ofMinutes(59));
        assertThat(service.checkDeadlines()).isZero();

        clock.advance(Duration.ofMinutes(2));
        assertThat(service.checkDeadlines()).isEqualTo(1);
        assertThat(service.checkDeadlines()).isZero();

        ArgumentCaptor<ReleaseNotice> captor = ArgumentCaptor.forClass(ReleaseNotice.class);
        verify(releaseNotifier).release(captor.capture());
        assertThat(captor.getValue().outcome()).isEqualTo(ReleaseOutcome.DEADLINE);
        assertThat(repository.findUnreleased()).isEmpty();
    }

    @Test
    @DisplayName("cancellation should mark the lock released without notifying anyone")
    void cancel() {
        LockRecord record = service.lockIncident("inc-2", 12);
        clock.advance(Duration.ofMinutes(3));

        service.cancelLock("inc-2");

        verify(releaseNotifier, never()).release(any());
        assertThat(repository.findById(record.lockId()).orElseThrow().outcome()).isEqualTo(ReleaseOutcome.CANCELLED);
        assertThat(service.status("inc-2").phase()).isEqualTo(TruthLockPhase.RELEASED_BY_CANCEL);
    }

    @Test
    @DisplayName("a second release should be rejected")
    void doubleRelease() {
        service.lockIncident("inc-3", 12);
        service.releaseEvidence("inc-3");

        assertThatThrownBy(() -> service.releaseEvidence("inc-3"))
                .isInstanceOfSatisfying(PreconditionFailedException.class,
                        e -> assertThat(e.getPrecondition()).isEqualTo(Precondition.ALREADY_RELEASED));
        verify(releaseNotifier).release(any());
    }

    @Test
    @DisplayName("unreleased locks should be restored and an overdue one released on startup")
    void restore() {
        Instant lockedAt = clock.instant().minus(Duration.ofHours(30));
        repository.save(new LockRecord("overdue", "inc-old", lockedAt, lockedAt.plus(Duration.ofHours(24)), 24,
                EvidenceHasher.hash(""), false, null, null));
        repository.save(new LockRecord("pending", "inc-new", clock.instant().minusSeconds(60),
                clock.instant().plus(Duration.ofHours(2)), 2, EvidenceHasher.hash(""), false, null, null));

        service.restoreUnreleasedLocks();

        verify(releaseNotifier).release(any());
        assertThat(repository.findUnreleased()).extracting(LockRecord::lockId).containsExactly("pending");
        assertThat(service.status("inc-new").phase()).isEqualTo(TruthLockPhase.LOCKED_CANCELLABLE);
        assertThat(service.status("inc-old").phase()).isEqualTo(TruthLockPhase.RELEASED_BY_DEADLINE);
    }

    @Test
    @DisplayName("a failing notifier should not break the release")
    void notifierFailure() {
        doThrow(new IllegalStateException("smtp down")).when(releaseNotifier).release(any());
        service.lockIncident("inc-4", 1);

        service.releaseEvidence("inc-4");

        assertThat(service.status("inc-4").phase()).isEqualTo(TruthLockPhase.RELEASED_MANUALLY);
    }

    @Test
    @DisplayName("a deadline release should still notify when its persistence fails")
    void persistenceFailureStillNotifies() {
        service.lockIncident("inc-5", 1);
        repository.failMarkReleased = true;
        clock.advance(Duration.ofHours(2));

        assertThat(service.checkDeadlines()).isEqualTo(1);

        ArgumentCaptor<ReleaseNotice> captor = ArgumentCaptor.forClass(ReleaseNotice.class);
        verify(releaseNotifier).release(captor.capture());
        assertThat(captor.getValue().outcome()).isEqualTo(ReleaseOutcome.DEADLINE);
        assertThat(service.status("inc-5").phase()).isEqualTo(TruthLockPhase.RELEASED_BY_DEADLINE);
    }

    @Test
    @DisplayName("a lock that cannot be saved should be rolled back")
    void saveFailureRollsBack() {
        service.addEvidence("inc-6", "audio", "clip");
        repository.failSave = true;

        assertThatThrownBy(() -> service.lockIncident("inc-6", 4))
                .isInstanceOf(IllegalStateException.class);
        assertThat(service.status("inc-6").phase()).isEqualTo(TruthLockPhase.UNLOCKED);
        assertThat(service.status("inc-6").evidenceCount()).isEqualTo(1);

        repository.failSave = false;
        LockRecord record = service.lockIncident("inc-6", 4);
        assertThat(repository.findUnreleased()).containsExactly(record);
    }

    @Test
    @DisplayName("queries for an unknown incident should not create a vault")
    void unknownIncident() {
        TruthLockStatus status = service.status("typo");

        assertThat(status.phase()).isEqualTo(TruthLockPhase.UNLOCKED);
        assertThat(status.lockId()).isNull();
        assertThatThrownBy(() -> service.cancelLock("typo"))
                .isInstanceOfSatisfying(PreconditionFailedException.class,
                        e -> assertThat(e.getPrecondition()).isEqualTo(Precondition.NOT_LOCKED));
        assertThatThrownBy(() -> service.releaseEvidence("typo"))
                .isInstanceOfSatisfying(PreconditionFailedException.class,
                        e -> assertThat(e.getPrecondition()).isEqualTo(Precondition.NOT_LOCKED));
        assertThat(service.find("typo")).isEmpty();
        assertThat(service.activeCount()).isZero();
    }

    @Test
    @DisplayName("released vaults should leave the active set but keep their terminal phase")
    void releasedVaultsLeaveActiveSet() {
        service.lockIncident("inc-7", 2);
        assertThat(service.activeCount()).isEqualTo(1);

        service.releaseEvidence("inc-7");

        assertThat(service.activeCount()).isZero();
        assertThat(service.status("inc-7").phase()).isEqualTo(TruthLockPhase.RELEASED_MANUALLY);
        assertThatThrownBy(() -> service.lockIncident("inc-7", 2))
                .isInstanceOfSatisfying(PreconditionFailedException.class,
                        e -> assertThat(e.getPrecondition()).isEqualTo(Precondition.ALREADY_RELEASED));
    }

    static class FlakyRepository extends InMemoryTruthLockRepository {

        boolean failSave;
        boolean failMarkReleased;

        @Override
        public void save(LockRecord record) {
            if (failSave) {
                throw new IllegalStateException("database unavailable");
            }
            super.save(record);
        }

        @Override
        public void markReleased(String lockId, ReleaseOutcome outcome, Instant releasedAt) {
            if (failMarkReleased) {
                throw new IllegalStateException("database unavailable");
            }
            super.markReleased(lockId, outcome, releasedAt);
        }
    }
}
