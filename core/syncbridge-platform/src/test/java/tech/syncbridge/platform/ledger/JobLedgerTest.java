package tech.syncbridge.platform.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.syncbridge.platform.TestConfigs;
import tech.syncbridge.platform.store.SyncStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JobLedgerTest {

    private JobLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new JobLedger(SyncStore.inMemory(), new ObjectMapper(), TestConfigs.ledger());
    }

    // ==================== Lifecycle ====================

    @Test
    @DisplayName("Start, checkpoint and terminal status are recorded on one entry")
    void record_shouldTrackLifecycle() {
        ledger.recordStart("job_1", LedgerKind.SYNC_JOB);
        ledger.recordCheckpoint("job_1", "{\"pull:contact\":\"100\"}");

        LedgerEntry running = ledger.find("job_1").orElseThrow();
        assertThat(running.kind()).isEqualTo(LedgerKind.SYNC_JOB);
        assertThat(running.status()).isEqualTo("STARTED");
        assertThat(running.cursor()).contains("100");
        assertThat(running.completedAt()).isNull();

        ledger.recordTerminal("job_1", "SUCCEEDED", Map.of("recordsWritten", 3));

        LedgerEntry done = ledger.find("job_1").orElseThrow();
        assertThat(done.status()).isEqualTo("SUCCEEDED");
        assertThat(done.statsJson()).contains("\"recordsWritten\":3");
        assertThat(done.completedAt()).isNotNull();
    }

    @Test
    @DisplayName("Restarting an entry clears its completion")
    void recordStart_shouldReopenEntry() {
        ledger.recordStart("job_1", LedgerKind.SYNC_JOB);
        ledger.recordTerminal("job_1", "FAILED", Map.of());

        ledger.recordStart("job_1", LedgerKind.SYNC_JOB);

        LedgerEntry entry = ledger.find("job_1").orElseThrow();
        assertThat(entry.status()).isEqualTo("STARTED");
        assertThat(entry.completedAt()).isNull();
    }

    // ==================== Idempotency ====================

    @Test
    @DisplayName("Marking a key twice is a no-op")
    void markProcessed_shouldBeIdempotent() {
        assertThat(ledger.isAlreadyProcessed("whk:int_1:evt_1")).isFalse();

        ledger.markProcessed("whk:int_1:evt_1", "evt_1");
        ledger.markProcessed("whk:int_1:evt_1", "evt_1");

        assertThat(ledger.isAlreadyProcessed("whk:int_1:evt_1")).isTrue();
        assertThat(ledger.isAlreadyProcessed("whk:int_1:evt_2")).isFalse();
    }

    // ==================== Compaction ====================

    @Test
    @DisplayName("Compaction keeps failures for the longer retention window")
    void compact_shouldKeepFailuresLonger() {
        ledger.recordStart("job_ok", LedgerKind.SYNC_JOB);
        ledger.recordTerminal("job_ok", "SUCCEEDED", Map.of());
        ledger.recordStart("job_bad", LedgerKind.SYNC_JOB);
        ledger.recordTerminal("job_bad", "FAILED", Map.of());
        ledger.recordStart("job_running", LedgerKind.SYNC_JOB);
        ledger.markProcessed("key-1", "job_ok");

        RetentionResult afterMonth = ledger.compact(Instant.now().plus(Duration.ofDays(31)));

        assertThat(afterMonth.ledgerEntries()).isEqualTo(1);
        assertThat(afterMonth.idempotencyKeys()).isEqualTo(1);
        assertThat(ledger.find("job_ok")).isEmpty();
        assertThat(ledger.find("job_bad")).isPresent();
        assertThat(ledger.isAlreadyProcessed("key-1")).isFalse();

        RetentionResult afterQuarter = ledger.compact(Instant.now().plus(Duration.ofDays(91)));

        assertThat(afterQuarter.ledgerEntries()).isEqualTo(1);
        assertThat(ledger.find("job_bad")).isEmpty();
        assertThat(ledger.find("job_running")).isPresent();
    }

    @Test
    @DisplayName("Recent work is untouched")
    void compact_shouldKeepRecentEntries() {
        ledger.recordStart("job_1", LedgerKind.SYNC_JOB);
        ledger.recordTerminal("job_1", "SUCCEEDED", Map.of());

        assertThat(ledger.compact(Instant.now()).total()).isZero();
        assertThat(ledger.find("job_1")).isPresent();
    }
}
