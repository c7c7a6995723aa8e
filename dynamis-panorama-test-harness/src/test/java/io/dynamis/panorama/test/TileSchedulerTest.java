package io.dynamis.panorama.test;

import io.dynamis.panorama.api.*;
import io.dynamis.panorama.core.*;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class TileSchedulerTest {

    private ManualWorker worker;
    private TileScheduler<String> scheduler;

    @BeforeEach
    void setUp() {
        worker = new ManualWorker();
        scheduler = new TileScheduler<>(worker, 2);
    }

    /** Candidate whose priority is exactly p. */
    private static TileCandidate candidate(int col, int row, double priority) {
        return new TileCandidate(new Tile(col, row), Math.PI / 2 - priority);
    }

    // -- Construction ---------------------------------------------------------

    @Test
    void defaultConcurrencyComesFromTilingConstants() {
        assertThat(new TileScheduler<>(worker).concurrency())
            .isEqualTo(TilingConstants.DEFAULT_FETCH_CONCURRENCY);
    }

    @Test
    void concurrencyBelowOneThrows() {
        assertThatThrownBy(() -> new TileScheduler<>(worker, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullWorkerThrows() {
        assertThatThrownBy(() -> new TileScheduler<String>(null, 2))
            .isInstanceOf(NullPointerException.class);
    }

    // -- Concurrency cap and priority order -----------------------------------

    @Test
    void startsOnlyConcurrencyTasksHighestPriorityFirst() {
        scheduler.submit(List.of(
            candidate(0, 0, 0.1),
            candidate(1, 0, 0.5),
            candidate(2, 0, 0.3),
            candidate(3, 0, 0.9),
            candidate(4, 0, 0.2)));

        assertThat(worker.started).containsExactly(new Tile(3, 0), new Tile(1, 0));
        assertThat(scheduler.runningCount()).isEqualTo(2);
        assertThat(scheduler.pendingCount()).isEqualTo(3);
        assertThat(scheduler.knownCount()).isEqualTo(5);
    }

    @Test
    void completionStartsExactlyOneMoreTask() {
        scheduler.submit(List.of(
            candidate(0, 0, 0.1),
            candidate(1, 0, 0.5),
            candidate(2, 0, 0.3),
            candidate(3, 0, 0.9),
            candidate(4, 0, 0.2)));

        worker.complete(new Tile(3, 0));

        assertThat(worker.started).containsExactly(new Tile(3, 0), new Tile(1, 0), new Tile(2, 0));
        assertThat(worker.done).containsExactly(new Tile(3, 0));
        assertThat(scheduler.runningCount()).isEqualTo(2);
        assertThat(scheduler.isKnown(new Tile(3, 0))).isFalse();
    }

    @Test
    void allTasksEventuallyRunWithinCap() {
        List<TileCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < 5; i++) candidates.add(candidate(i, 1, 0.1 * (i + 1)));
        scheduler.submit(candidates);

        while (!worker.inFlight.isEmpty()) {
            assertThat(scheduler.runningCount()).isLessThanOrEqualTo(2);
            worker.complete(worker.inFlight.keySet().iterator().next());
        }

        assertThat(worker.done).hasSize(5);
        assertThat(scheduler.knownCount()).isZero();
        assertThat(scheduler.peakRunning()).isEqualTo(2);
        assertThat(scheduler.completedCount()).isEqualTo(5);
    }

    @Test
    void equalPrioritiesStartInSubmissionOrder() {
        scheduler.submit(List.of(
            candidate(5, 2, 0.4),
            candidate(1, 2, 0.4),
            candidate(3, 2, 0.4)));

        assertThat(worker.started).containsExactly(new Tile(5, 2), new Tile(1, 2));
    }

    @Test
    void tiesAreBrokenBySubmissionSequence() {
        scheduler = new TileScheduler<>(worker, 1);
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(4, 0, 0.4), candidate(2, 0, 0.4)));
        scheduler.submit(List.of(candidate(2, 0, 0.4), candidate(4, 0, 0.4)));

        List<ScheduledTask> snapshot = scheduler.snapshot();
        assertThat(snapshot).extracting(ScheduledTask::sequence).isSorted();
        assertThat(scheduler.taskFor(new Tile(4, 0)).sequence())
            .isLessThan(scheduler.taskFor(new Tile(2, 0)).sequence());

        worker.complete(new Tile(0, 0));

        assertThat(worker.started).containsExactly(new Tile(0, 0), new Tile(4, 0));
    }

    @Test
    void nonPositivePriorityNeverStarts() {
        scheduler.submit(List.of(
            new TileCandidate(new Tile(0, 0), Math.PI / 2),
            new TileCandidate(new Tile(1, 0), 2.5)));

        assertThat(worker.started).isEmpty();
        assertThat(scheduler.knownCount()).isEqualTo(2);
        assertThat(scheduler.status(new Tile(0, 0))).isEqualTo(TaskStatus.PENDING);
    }

    // -- Deduplication and reprioritisation -----------------------------------

    @Test
    void duplicateTileInOneSubmitIsTrackedOnceWithLatestPriority() {
        scheduler = new TileScheduler<>(worker, 1);
        scheduler.submit(List.of(
            candidate(9, 0, 0.1),
            candidate(2, 0, 0.5),
            candidate(9, 0, 0.8)));

        assertThat(scheduler.knownCount()).isEqualTo(2);
        assertThat(worker.started).containsExactly(new Tile(9, 0));
    }

    @Test
    void resubmittingKnownTileDoesNotCreateSecondTask() {
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.8), candidate(2, 0, 0.7)));
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.8), candidate(2, 0, 0.7)));

        assertThat(scheduler.knownCount()).isEqualTo(3);
        assertThat(worker.started).containsExactly(new Tile(0, 0), new Tile(1, 0));
        assertThat(scheduler.startedCount()).isEqualTo(2);
    }

    @Test
    void latestSubmitReordersPendingTasks() {
        scheduler = new TileScheduler<>(worker, 1);
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.2), candidate(2, 0, 0.1)));
        scheduler.submit(List.of(candidate(1, 0, 0.2), candidate(2, 0, 0.7)));

        worker.complete(new Tile(0, 0));

        assertThat(worker.started).containsExactly(new Tile(0, 0), new Tile(2, 0));
    }

    @Test
    void tilesMissingFromLatestSubmitAreNeverNewlyStarted() {
        scheduler = new TileScheduler<>(worker, 1);
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.8), candidate(2, 0, 0.7)));
        scheduler.submit(List.of(candidate(2, 0, 0.7)));

        worker.complete(new Tile(0, 0));
        worker.complete(new Tile(2, 0));

        assertThat(worker.started).containsExactly(new Tile(0, 0), new Tile(2, 0));
        assertThat(scheduler.status(new Tile(1, 0))).isEqualTo(TaskStatus.PENDING);
        assertThat(scheduler.taskFor(new Tile(1, 0)).priority()).isEqualTo(TilingConstants.DEMOTED_PRIORITY);
        assertThat(scheduler.runningCount()).isZero();
    }

    @Test
    void demotedRunningTaskIsNotPreempted() {
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.8)));
        scheduler.submit(List.of(candidate(5, 5, 0.95)));

        assertThat(scheduler.status(new Tile(0, 0))).isEqualTo(TaskStatus.RUNNING);
        assertThat(worker.started).doesNotContain(new Tile(5, 5));

        worker.complete(new Tile(0, 0));

        assertThat(worker.done).containsExactly(new Tile(0, 0));
        assertThat(worker.started).endsWith(new Tile(5, 5));
    }

    // -- Failure --------------------------------------------------------------

    @Test
    void failedTaskIsReportedWithUnwrappedCauseAndRemoved() {
        scheduler.submit(List.of(candidate(0, 0, 0.9)));
        IOException boom = new IOException("404");

        worker.fail(new Tile(0, 0), boom);

        assertThat(worker.failed).containsEntry(new Tile(0, 0), boom);
        assertThat(scheduler.isKnown(new Tile(0, 0))).isFalse();
        assertThat(scheduler.failedCount()).isEqualTo(1);
        assertThat(scheduler.runningCount()).isZero();
    }

    @Test
    void failedTileIsRetriedWhenVisibleAgain() {
        scheduler.submit(List.of(candidate(0, 0, 0.9)));
        worker.fail(new Tile(0, 0), new IOException("reset"));

        scheduler.submit(List.of(candidate(0, 0, 0.9)));

        assertThat(worker.started).containsExactly(new Tile(0, 0), new Tile(0, 0));
        assertThat(scheduler.status(new Tile(0, 0))).isEqualTo(TaskStatus.RUNNING);
    }

    @Test
    void failureFreesSlotForNextTask() {
        scheduler = new TileScheduler<>(worker, 1);
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.5)));

        worker.fail(new Tile(0, 0), new IOException("timeout"));

        assertThat(worker.started).containsExactly(new Tile(0, 0), new Tile(1, 0));
    }

    @Test
    void workerThrowingSynchronouslyCountsAsFailure() {
        TileScheduler<String> throwing = new TileScheduler<>(new ManualWorker() {
            @Override
            public CompletionStage<String> start(Tile tile) {
                super.start(tile);
                throw new IllegalStateException("no network");
            }
        }, 2);
        throwing.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.8), candidate(2, 0, 0.7)));

        assertThat(throwing.failedCount()).isEqualTo(3);
        assertThat(throwing.runningCount()).isZero();
        assertThat(throwing.knownCount()).isZero();
    }

    @Test
    void synchronousCompletionsDrainQueueWithinCap() {
        SyncWorker sync = new SyncWorker();
        TileScheduler<String> s = new TileScheduler<>(sync, 2);
        sync.scheduler = s;
        List<TileCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < 10; i++) candidates.add(candidate(i, 0, 0.05 * (i + 1)));

        s.submit(candidates);

        assertThat(sync.done).hasSize(10);
        assertThat(sync.maxRunningSeen).isLessThanOrEqualTo(2);
        assertThat(s.peakRunning()).isLessThanOrEqualTo(2);
        assertThat(s.knownCount()).isZero();
    }

    @Test
    void longRunOfSynchronousCompletionsDoesNotExhaustStack() {
        SyncWorker sync = new SyncWorker();
        TileScheduler<String> s = new TileScheduler<>(sync, 2);
        sync.scheduler = s;
        List<TileCandidate> candidates = new ArrayList<>();
        for (int col = 0; col < 80; col++) {
            for (int row = 0; row < 64; row++) {
                candidates.add(new TileCandidate(new Tile(col, row), 0.1));
            }
        }

        s.submit(candidates);

        assertThat(sync.done).hasSize(5_120);
        assertThat(s.completedCount()).isEqualTo(5_120);
        assertThat(s.runningCount()).isZero();
        assertThat(s.knownCount()).isZero();
        assertThat(s.peakRunning()).isLessThanOrEqualTo(2);

        s.submit(List.of(candidate(0, 0, 0.5)));
        assertThat(sync.done).hasSize(5_121);
        assertThat(s.runningCount()).isZero();
    }

    @Test
    void callbackExceptionDoesNotStallScheduling() {
        ManualWorker exploding = new ManualWorker() {
            @Override
            public void onDone(Tile tile, String result) {
                throw new IllegalStateException("sink gone");
            }
        };
        TileScheduler<String> s = new TileScheduler<>(exploding, 1);
        s.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.5)));

        exploding.complete(new Tile(0, 0));

        assertThat(exploding.started).containsExactly(new Tile(0, 0), new Tile(1, 0));
        assertThat(s.runningCount()).isEqualTo(1);
    }

    // -- Clear ----------------------------------------------------------------

    @Test
    void clearCancelsEverythingAndEmptiesKnownSet() {
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.8), candidate(2, 0, 0.7)));
        List<CompletableFuture<String>> inFlight = new ArrayList<>(worker.inFlight.values());

        scheduler.clear();

        assertThat(scheduler.knownCount()).isZero();
        assertThat(scheduler.runningCount()).isZero();
        assertThat(scheduler.cancelledCount()).isEqualTo(3);
        assertThat(inFlight).allMatch(CompletableFuture::isCancelled);
        assertThat(worker.done).isEmpty();
        assertThat(worker.failed).isEmpty();
    }

    @Test
    void emptySubmitAfterClearStartsNothing() {
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.8), candidate(2, 0, 0.7)));
        scheduler.clear();

        scheduler.submit(List.of());

        assertThat(worker.started).hasSize(2);
        assertThat(scheduler.knownCount()).isZero();
        assertThat(scheduler.runningCount()).isZero();
    }

    @Test
    void lateResultOfCancelledTaskIsDiscarded() {
        worker.ignoreAbort = true;
        scheduler.submit(List.of(candidate(0, 0, 0.9), candidate(1, 0, 0.8)));
        scheduler.clear();
        scheduler.submit(List.of(candidate(7, 7, 0.3)));

        worker.complete(new Tile(0, 0));
        worker.fail(new Tile(1, 0), new IOException("late"));

        assertThat(worker.done).isEmpty();
        assertThat(worker.failed).isEmpty();
        assertThat(scheduler.runningCount()).isEqualTo(1);
        assertThat(scheduler.status(new Tile(7, 7))).isEqualTo(TaskStatus.RUNNING);
        assertThat(scheduler.completedCount()).isZero();
    }

    @Test
    void tileClearedWhileRunningCanBeRequestedAgain() {
        worker.ignoreAbort = true;
        scheduler.submit(List.of(candidate(0, 0, 0.9)));
        scheduler.clear();
        scheduler.submit(List.of(candidate(0, 0, 0.9)));

        assertThat(worker.started).containsExactly(new Tile(0, 0), new Tile(0, 0));
        assertThat(scheduler.generation()).isEqualTo(1);
        assertThat(scheduler.taskFor(new Tile(0, 0)).generation()).isEqualTo(1);
    }

    // -- Consistency under load -----------------------------------------------

    @Test
    void randomOperationSequenceKeepsRunningCountConsistent() {
        Random random = new Random(42);
        worker.ignoreAbort = true;
        scheduler = new TileScheduler<>(worker, 3);

        for (int step = 0; step < 2_000; step++) {
            int op = random.nextInt(10);
            if (op < 4) {
                List<TileCandidate> candidates = new ArrayList<>();
                int n = random.nextInt(8);
                for (int i = 0; i < n; i++) {
                    candidates.add(new TileCandidate(
                        new Tile(random.nextInt(8), random.nextInt(4)), random.nextDouble() * 2.5));
                }
                scheduler.submit(candidates);
            } else if (op < 8 && !worker.inFlight.isEmpty()) {
                List<Tile> tiles = new ArrayList<>(worker.inFlight.keySet());
                Tile tile = tiles.get(random.nextInt(tiles.size()));
                if (random.nextBoolean()) worker.complete(tile);
                else worker.fail(tile, new IOException("x"));
            } else if (op == 9) {
                scheduler.clear();
            }

            List<ScheduledTask> snapshot = scheduler.snapshot();
            long runningInSnapshot = snapshot.stream().filter(t -> t.status() == TaskStatus.RUNNING).count();
            Set<String> ids = new HashSet<>();
            for (ScheduledTask task : snapshot) {
                assertThat(ids.add(task.tile().id())).as("duplicate id at step %d", step).isTrue();
                assertThat(task.status().isTerminal()).isFalse();
            }
            assertThat(scheduler.runningCount()).isEqualTo((int) runningInSnapshot);
            assertThat(scheduler.runningCount()).isLessThanOrEqualTo(3);
        }
        assertThat(scheduler.peakRunning()).isLessThanOrEqualTo(3);
    }

    @Test
    void concurrentCompletionsRespectCap() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            PooledWorker pooled = new PooledWorker(pool);
            TileScheduler<String> s = new TileScheduler<>(pooled, 2);
            pooled.scheduler = s;
            List<TileCandidate> candidates = new ArrayList<>();
            for (int col = 0; col < 16; col++) {
                for (int row = 0; row < 4; row++) {
                    candidates.add(new TileCandidate(new Tile(col, row), 0.01 * (col + row)));
                }
            }

            s.submit(candidates);

            assertThat(pooled.allDone.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(pooled.maxRunningSeen).isLessThanOrEqualTo(2);
            assertThat(s.peakRunning()).isLessThanOrEqualTo(2);
            assertThat(s.completedCount()).isEqualTo(64);
            assertThat(s.knownCount()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    // -- Workers --------------------------------------------------------------

    /** Worker whose fetches complete only when the test says so. */
    static class ManualWorker implements TileWorker<String> {

        final Map<Tile, CompletableFuture<String>> inFlight = new LinkedHashMap<>();
        final List<Tile> started = new ArrayList<>();
        final List<Tile> done = new ArrayList<>();
        final Map<Tile, Throwable> failed = new LinkedHashMap<>();
        boolean ignoreAbort = false;

        @Override
        public CompletionStage<String> start(Tile tile) {
            started.add(tile);
            CompletableFuture<String> future = new CompletableFuture<>();
            inFlight.put(tile, future);
            return ignoreAbort ? future.minimalCompletionStage() : future;
        }

        @Override
        public void onDone(Tile tile, String result) {
            done.add(tile);
        }

        @Override
        public void onFailed(Tile tile, Throwable cause) {
            failed.put(tile, cause);
        }

        void complete(Tile tile) {
            inFlight.remove(tile).complete("image-" + tile.id());
        }

        void fail(Tile tile, Throwable cause) {
            inFlight.remove(tile).completeExceptionally(cause);
        }
    }

    /** Worker whose fetches are already complete when returned. */
    static final class SyncWorker implements TileWorker<String> {

        TileScheduler<String> scheduler;
        final List<Tile> done = new ArrayList<>();
        int maxRunningSeen = 0;

        @Override
        public CompletionStage<String> start(Tile tile) {
            maxRunningSeen = Math.max(maxRunningSeen, scheduler.runningCount());
            return CompletableFuture.completedFuture(tile.id());
        }

        @Override
        public void onDone(Tile tile, String result) {
            done.add(tile);
        }

        @Override
        public void onFailed(Tile tile, Throwable cause) {
            throw new AssertionError("unexpected failure of " + tile, cause);
        }
    }

    /** Worker completing fetches on a thread pool. */
    static final class PooledWorker implements TileWorker<String> {

        private final ExecutorService pool;
        final CountDownLatch allDone = new CountDownLatch(64);
        volatile TileScheduler<String> scheduler;
        volatile int maxRunningSeen = 0;

        PooledWorker(ExecutorService pool) {
            this.pool = pool;
        }

        @Override
        public CompletionStage<String> start(Tile tile) {
            return CompletableFuture.supplyAsync(() -> {
                int running = scheduler.runningCount();
                synchronized (this) {
                    maxRunningSeen = Math.max(maxRunningSeen, running);
                }
                return tile.id();
            }, pool);
        }

        @Override
        public void onDone(Tile tile, String result) {
            allDone.countDown();
        }

        @Override
        public void onFailed(Tile tile, Throwable cause) {
            allDone.countDown();
        }
    }
}
