package com.eainde.safepulse.truthlock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcTruthLockRepositoryTest {

    private static final Instant LOCKED_AT = Instant.parse("2025-07-01T22:00:00Z");

    private EmbeddedDatabase database;
    private JdbcTruthLockRepository repository;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .setName("truthlock-" + UUID.randomUUID())
                .addScript("db/truth_lock_schema.sql")
                .build();
        repository = new JdbcTruthLockRepository(new JdbcTemplate(database));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("saved locks should be listed as unreleased in lock order")
    void saveAndList() {
        repository.save(record("lock-b", LOCKED_AT.plusSeconds(60)));
        repository.save(record("lock-a", LOCKED_AT));

        assertThat(repository.findUnreleased())
                .extracting(LockRecord::lockId)
                .containsExactly("lock-a", "lock-b");
        assertThat(repository.findById("lock-a")).contains(record("lock-a", LOCKED_AT));
    }

    @Test
    @DisplayName("markReleased should keep the first terminal outcome")
    void firstOutcomeWins() {
        repository.save(record("lock-1", LOCKED_AT));

        repository.markReleased("lock-1", ReleaseOutcome.CANCELLED, LOCKED_AT.plusSeconds(120));
        repository.markReleased("lock-1", ReleaseOutcome.MANUAL, LOCKED_AT.plusSeconds(180));

        LockRecord stored = repository.findById("lock-1").orElseThrow();
        assertThat(stored.released()).isTrue();
        assertThat(stored.outcome()).isEqualTo(ReleaseOutcome.CANCELLED);
        assertThat(stored.releasedAt()).isEqualTo(LOCKED_AT.plusSeconds(120));
        assertThat(repository.findUnreleased()).isEmpty();
    }

    @Test
    @DisplayName("an unknown lock id should not be found")
    void unknown() {
        assertThat(repository.findById("missing")).isEmpty();
    }

    private static LockRecord record(String lockId, Instant lockedAt) {
        return new LockRecord(lockId, "incident-" + lockId, lockedAt, lockedAt.plus(Duration.ofHours(24)), 24,
                EvidenceHasher.hash(lockId), false, null, null);
    }
}
