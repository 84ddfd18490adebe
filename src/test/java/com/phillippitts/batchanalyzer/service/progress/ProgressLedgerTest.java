package com.phillippitts.batchanalyzer.service.progress;

import com.phillippitts.batchanalyzer.exception.CheckpointException;
import com.phillippitts.batchanalyzer.testutil.InMemoryCheckpointStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProgressLedgerTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();

    @Test
    void countersStayConsistentWithIdentifierSets() {
        ProgressLedger ledger = new ProgressLedger("run-1", store, 100);
        ledger.start(5);

        ledger.recordSuccess("a", 0.01);
        ledger.recordDerived("b");
        ledger.recordFailure("c", "timeout");
        ledger.recordSkipped("d", "budget exhausted");

        ProgressSnapshot s = ledger.snapshot();
        assertThat(s.state()).isEqualTo(RunState.RUNNING);
        assertThat(s.total()).isEqualTo(5);
        assertThat(s.processed()).isEqualTo(3);
        assertThat(s.succeeded()).isEqualTo(2);
        assertThat(s.failed()).isEqualTo(1);
        assertThat(s.skipped()).isEqualTo(1);
        assertThat(s.processedIds()).containsExactly("a", "b");
        assertThat(s.failedIds()).containsEntry("c", "timeout");
        assertThat(s.cumulativeCost()).isEqualTo(0.01);
        assertThat(ledger.isProcessed("a")).isTrue();
        assertThat(ledger.isProcessed("c")).isFalse();
    }

    @Test
    void writesCheckpointEveryIntervalItems() {
        ProgressLedger ledger = new ProgressLedger("run-2", store, 2);
        ledger.start(5);

        ledger.recordSuccess("a", 0.0);
        assertThat(store.saves.get()).isZero();
        ledger.recordDerived("b");
        assertThat(store.saves.get()).isEqualTo(1);
        ledger.recordFailure("c", "x");
        ledger.recordSuccess("d", 0.0);
        assertThat(store.saves.get()).isEqualTo(2);
        assertThat(store.load("run-2")).get()
                .satisfies(s -> assertThat(s.processedIds()).containsExactly("a", "b", "d"));
    }

    @Test
    void checkpointNowWritesOnlyWhileRunning() {
        ProgressLedger ledger = new ProgressLedger("run-2b", store, 100);
        assertThat(ledger.checkpointNow()).isFalse();
        ledger.start(2);
        ledger.recordSuccess("a", 0.0);

        assertThat(ledger.checkpointNow()).isTrue();
        assertThat(store.load("run-2b")).get()
                .satisfies(s -> assertThat(s.processedIds()).containsExactly("a"));

        ledger.recordSuccess("b", 0.0);
        ledger.complete();
        assertThat(ledger.checkpointNow()).isFalse();
        assertThat(store.load("run-2b")).isEmpty();
    }

    @Test
    void repeatedSuccessCountsItemOnceButChargesEveryCall() {
        ProgressLedger ledger = new ProgressLedger("run-3", store, 100);
        ledger.start(2);

        ledger.recordSuccess("a", 0.5);
        ledger.recordSuccess("a", 0.5);
        ledger.recordFailure("a", "late failure");

        ProgressSnapshot s = ledger.snapshot();
        assertThat(s.processed()).isEqualTo(1);
        assertThat(s.failed()).isZero();
        assertThat(s.cumulativeCost()).isEqualTo(1.0);
    }

    @Test
    void successAfterFailureMovesItemToProcessed() {
        ProgressLedger ledger = new ProgressLedger("run-4", store, 100);
        ledger.start(1);

        ledger.recordFailure("a", "rate limited");
        ledger.recordSuccess("a", 0.02);

        ProgressSnapshot s = ledger.snapshot();
        assertThat(s.processed()).isEqualTo(1);
        assertThat(s.succeeded()).isEqualTo(1);
        assertThat(s.failed()).isZero();
        assertThat(s.failedIds()).isEmpty();
    }

    @Test
    void cleanCompletionDeletesCheckpoint() {
        ProgressLedger ledger = new ProgressLedger("run-5", store, 1);
        ledger.start(1);
        ledger.recordSuccess("a", 0.0);
        assertThat(store.contains("run-5")).isTrue();

        ledger.complete();

        assertThat(ledger.state()).isEqualTo(RunState.COMPLETED);
        assertThat(store.contains("run-5")).isFalse();
    }

    @Test
    void completionWithFailuresKeepsCheckpoint() {
        ProgressLedger ledger = new ProgressLedger("run-6", store, 100);
        ledger.start(2);
        ledger.recordSuccess("a", 0.0);
        ledger.recordFailure("b", "auth");

        ledger.complete();

        assertThat(store.load("run-6")).get().satisfies(s -> {
            assertThat(s.state()).isEqualTo(RunState.COMPLETED);
            assertThat(s.failedIds()).containsOnlyKeys("b");
        });
    }

    @Test
    void abortPersistsProgress() {
        ProgressLedger ledger = new ProgressLedger("run-7", store, 100);
        ledger.start(3);
        ledger.recordSuccess("a", 0.03);

        ledger.abort();

        assertThat(ledger.state()).isEqualTo(RunState.ABORTED);
        assertThat(store.load("run-7")).get().satisfies(s -> {
            assertThat(s.state()).isEqualTo(RunState.ABORTED);
            assertThat(s.processedIds()).containsExactly("a");
        });
        assertThatThrownBy(() -> ledger.recordSuccess("b", 0.0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void restoreResumesProcessedItemsAndRetriesFailures() {
        store.save(new ProgressSnapshot("run-8", RunState.ABORTED, 4, 3, 2, 1, 1, 0.25,
                List.of("a", "b"), Map.of("c", "timeout"), Instant.now()));
        ProgressLedger ledger = new ProgressLedger("run-8", store, 100);

        assertThat(ledger.restore()).isTrue();
        ledger.start(4);

        assertThat(ledger.isResumed()).isTrue();
        assertThat(ledger.isProcessed("a")).isTrue();
        assertThat(ledger.isProcessed("c")).isFalse();
        assertThat(ledger.failureReason("c")).contains("timeout");
        assertThat(ledger.cumulativeCost()).isEqualTo(0.25);
        assertThat(ledger.snapshot().skipped()).isZero();

        ledger.recordSuccess("c", 0.01);
        assertThat(ledger.snapshot().failedIds()).isEmpty();
        assertThat(ledger.cumulativeCost()).isCloseTo(0.26, within(1e-12));
    }

    @Test
    void restoreWithoutCheckpointStartsFresh() {
        ProgressLedger ledger = new ProgressLedger("run-9", store, 100);

        assertThat(ledger.restore()).isFalse();
        assertThat(ledger.isResumed()).isFalse();
        assertThat(ledger.isResumabilityCompromised()).isFalse();
    }

    @Test
    void unreadableCheckpointStartsFreshAndFlagsResumability() {
        CheckpointStore broken = new CheckpointStore() {
            @Override
            public Optional<ProgressSnapshot> load(String runToken) {
                throw new CheckpointException("corrupt", runToken, null);
            }

            @Override
            public void save(ProgressSnapshot snapshot) {
            }

            @Override
            public void delete(String runToken) {
            }
        };
        ProgressLedger ledger = new ProgressLedger("run-10", broken, 100);

        assertThat(ledger.restore()).isFalse();
        assertThat(ledger.isResumabilityCompromised()).isTrue();
    }

    @Test
    void checkpointWriteFailureDoesNotFailTheRun() {
        store.failWrites = true;
        ProgressLedger ledger = new ProgressLedger("run-11", store, 1);
        ledger.start(2);

        ledger.recordSuccess("a", 0.0);
        ledger.recordSuccess("b", 0.0);

        assertThat(ledger.isResumabilityCompromised()).isTrue();
        assertThat(ledger.snapshot().processed()).isEqualTo(2);
    }

    @Test
    void restoreIsOnlyAllowedBeforeStart() {
        ProgressLedger ledger = new ProgressLedger("run-12", store, 1);
        ledger.start(0);

        assertThatThrownBy(ledger::restore).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new ProgressLedger("run", store, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
