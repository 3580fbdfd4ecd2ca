package de.bsommerfeld.feedsim.db.repository;

import de.bsommerfeld.feedsim.core.domain.Run;
import de.bsommerfeld.feedsim.core.domain.RunConfig;
import de.bsommerfeld.feedsim.core.domain.RunStatus;
import de.bsommerfeld.feedsim.core.domain.TurnAction;
import de.bsommerfeld.feedsim.core.domain.TurnMetadata;
import de.bsommerfeld.feedsim.db.SqliteDatabase;
import de.bsommerfeld.feedsim.db.adapter.SqlRunAdapter;
import de.bsommerfeld.feedsim.db.exception.DuplicateTurnMetadataException;
import de.bsommerfeld.feedsim.db.exception.InvalidTransitionException;
import de.bsommerfeld.feedsim.db.exception.RunNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RunRepository against a real temporary SQLite database.
 */
class RunRepositoryIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteDatabase database;
    private RunRepository repository;

    /**
     * Holds the first {@code parties} reads until all of them have read, so
     * that every writer sees the same status before any of them writes.
     */
    static class BarrierRunAdapter extends SqlRunAdapter {

        private final CyclicBarrier barrier;
        private final AtomicInteger pendingReads;

        BarrierRunAdapter(SqliteDatabase database, int parties) {
            super(database);
            this.barrier = new CyclicBarrier(parties);
            this.pendingReads = new AtomicInteger(parties);
        }

        @Override
        public Optional<Run> readRun(String runId) {
            Optional<Run> run = super.readRun(runId);
            if (pendingReads.getAndDecrement() > 0) {
                try {
                    barrier.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException | BrokenBarrierException | TimeoutException e) {
                    throw new IllegalStateException(e);
                }
            }
            return run;
        }
    }

    @BeforeEach
    void setUp() {
        database = new SqliteDatabase(tempDir.resolve("test.db"));
        repository = new RunRepository(new SqlRunAdapter(database), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createRun_shouldRoundTripThroughStorage() {
        Run created = repository.createRun(new RunConfig(2, 3));

        assertEquals(created, repository.getRun(created.runId()).orElseThrow());
    }

    @Test
    void updateRunStatus_shouldTreatFailedAsTerminal() {
        Run run = repository.createRun(new RunConfig(1, 1));
        repository.updateRunStatus(run.runId(), RunStatus.FAILED);

        assertThrows(InvalidTransitionException.class,
                () -> repository.updateRunStatus(run.runId(), RunStatus.COMPLETED));
        assertEquals(RunStatus.FAILED, repository.getRun(run.runId()).orElseThrow().status());
    }

    @Test
    void updateRunStatus_shouldPersistCompletion() {
        Run run = repository.createRun(new RunConfig(1, 1));
        repository.updateRunStatus(run.runId(), RunStatus.COMPLETED);

        Run loaded = repository.getRun(run.runId()).orElseThrow();
        assertEquals(RunStatus.COMPLETED, loaded.status());
        assertEquals(NOW, loaded.completedAt());
    }

    @Test
    void updateRunStatus_shouldNotCreateRowForUnknownRun() {
        assertThrows(RunNotFoundException.class, () -> repository.updateRunStatus("run_ghost", RunStatus.FAILED));
        assertTrue(repository.listRuns().isEmpty());
    }

    @Test
    void updateRunStatus_shouldLetOnlyOneOfTwoConcurrentTerminalTransitionsWin() throws Exception {
        Run run = repository.createRun(new RunConfig(1, 1));
        RunRepository racing = new RunRepository(new BarrierRunAdapter(database, 2), Clock.fixed(NOW, ZoneOffset.UTC));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<Run>> futures = new ArrayList<>();
        try {
            for (RunStatus target : List.of(RunStatus.FAILED, RunStatus.COMPLETED)) {
                Callable<Run> task = () -> racing.updateRunStatus(run.runId(), target);
                futures.add(executor.submit(task));
            }

            List<Run> winners = new ArrayList<>();
            int rejected = 0;
            for (Future<Run> future : futures) {
                try {
                    winners.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    assertInstanceOf(InvalidTransitionException.class, e.getCause());
                    rejected++;
                }
            }

            assertEquals(1, winners.size());
            assertEquals(1, rejected);
            assertEquals(winners.get(0).status(), repository.getRun(run.runId()).orElseThrow().status());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void writeTurnMetadata_shouldKeepFirstRecordOnDuplicate() {
        Run run = repository.createRun(new RunConfig(1, 2));
        TurnMetadata first = new TurnMetadata(run.runId(), 0, Map.of(TurnAction.LIKE, 1), NOW);
        repository.writeTurnMetadata(first);

        assertThrows(DuplicateTurnMetadataException.class, () -> repository.writeTurnMetadata(
                new TurnMetadata(run.runId(), 0, Map.of(TurnAction.LIKE, 99), NOW)));

        assertEquals(1, repository.getTurnMetadata(run.runId(), 0).orElseThrow().count(TurnAction.LIKE));
        assertEquals(1, repository.listTurnMetadata(run.runId()).size());
    }
}
