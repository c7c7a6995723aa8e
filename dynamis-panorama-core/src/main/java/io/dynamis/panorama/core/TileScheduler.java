package io.dynamis.panorama.core;

import io.dynamis.panorama.api.TaskStatus;
import io.dynamis.panorama.api.Tile;
import io.dynamis.panorama.api.TileCandidate;
import io.dynamis.panorama.api.TilingConstants;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Priority-driven, concurrency-limited tile fetch scheduler.
 *
 * Keeps the known set: one ScheduledTask per tile id that has been requested and
 * has not yet settled. Each submit() replaces the priorities of the whole set with
 * those of the current visible tiles; schedule() keeps at most `concurrency` tasks
 * RUNNING and always starts the PENDING task with the highest positive priority.
 *
 * PRIORITY MODEL:
 *   priority = PI/2 - angle from the view center.
 *   submit() first demotes every known task to DEMOTED_PRIORITY (0), so tiles that
 *   left the view are never newly started. RUNNING tasks are never preempted; a
 *   demoted RUNNING task runs to completion.
 *   Ties are broken by ScheduledTask.sequence() (earliest submitted first).
 *
 * LIFECYCLE:
 *   PENDING -> RUNNING -> DONE | FAILED, or PENDING | RUNNING -> CANCELLED on clear().
 *   Terminal tasks are removed from the known set, so a tile that failed is
 *   requested again as a fresh PENDING task the next time it becomes visible.
 *
 * THREAD SAFETY:
 *   All state is guarded by this scheduler's monitor. submit(), schedule(), clear()
 *   and fetch completions form one serialised sequence. Completions may arrive on any
 *   thread, including synchronously from inside TileWorker.start(). schedule() is
 *   not reentrant: a completion settling inside the fill loop only frees its slot
 *   and the running loop refills it, so a long run of synchronous completions
 *   iterates instead of recursing.
 *   clear() empties the known set and bumps the generation before cancelling, so a
 *   cancelled task's completion finds nothing to update and never restarts scheduling.
 *
 * NO TIMEOUT:
 *   A fetch that never settles holds its slot until clear(). Timeouts belong to the
 *   fetch implementation.
 *
 * @param <R> result type of a successful fetch
 */
public final class TileScheduler<R> {

    private static final Logger logger = LoggerFactory.getLogger(TileScheduler.class);

    // -- Configuration --------------------------------------------------------

    private final int concurrency;
    private final TileWorker<R> worker;

    // -- Known set (guarded by this) ------------------------------------------

    private final Map<String, ScheduledTask> known = new LinkedHashMap<>();
    private int running = 0;
    private long nextSequence = 0L;
    private long generation = 0L;

    /** True while schedule() is filling slots on the lock-holding thread. */
    private boolean scheduling = false;

    // -- Telemetry (written under lock, read anywhere) -----------------------

    private volatile long startedCount = 0L;
    private volatile long completedCount = 0L;
    private volatile long failedCount = 0L;
    private volatile long cancelledCount = 0L;
    private volatile int peakRunning = 0;

    // -- Construction ---------------------------------------------------------

    /**
     * @param worker      performs the fetch of each started tile
     * @param concurrency maximum number of RUNNING tasks; must be >= 1
     * @throws IllegalArgumentException if concurrency < 1
     */
    public TileScheduler(TileWorker<R> worker, int concurrency) {
        if (worker == null) {
            throw new NullPointerException("worker");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1; got " + concurrency);
        }
        this.worker = worker;
        this.concurrency = concurrency;
    }

    /** Constructs with the default concurrency from TilingConstants. */
    public TileScheduler(TileWorker<R> worker) {
        this(worker, TilingConstants.DEFAULT_FETCH_CONCURRENCY);
    }

    // -- Operations -----------------------------------------------------------

    /**
     * Merges the current visible tiles into the known set and fills free slots.
     *
     * Every known task is first demoted to DEMOTED_PRIORITY. Then each candidate
     * either updates the priority of its existing task (the latest value wins, also
     * for a tile listed twice in the same call) or creates a new PENDING task.
     *
     * @param candidates visible tiles with their angle from the view center; may be empty
     */
    public synchronized void submit(Collection<TileCandidate> candidates) {
        if (candidates == null) {
            throw new NullPointerException("candidates");
        }
        for (ScheduledTask task : known.values()) {
            task.setPriority(TilingConstants.DEMOTED_PRIORITY);
        }

        int created = 0;
        int updated = 0;
        for (TileCandidate candidate : candidates) {
            String id = candidate.tile().id();
            double priority = candidate.priority();
            ScheduledTask existing = known.get(id);
            if (existing != null) {
                existing.setPriority(priority);
                updated++;
            } else {
                known.put(id, new ScheduledTask(candidate.tile(), priority, nextSequence++, generation));
                created++;
            }
        }
        logger.debug("Submitted {} candidates: {} new, {} reprioritised, {} known, {} running",
            candidates.size(), created, updated, known.size(), running);

        schedule();
    }

    /**
     * Starts PENDING tasks, highest priority first, until every slot is taken or no
     * task with priority > 0 remains. Called automatically by submit() and after
     * each settled fetch.
     */
    public synchronized void schedule() {
        if (scheduling) {
            return;
        }
        scheduling = true;
        try {
            while (running < concurrency) {
                ScheduledTask next = selectNext();
                if (next == null) {
                    return;
                }
                start(next);
            }
        } finally {
            scheduling = false;
        }
    }

    /**
     * Cancels every known task and resets the scheduler.
     *
     * The known set is emptied and the running count reset before any task is
     * cancelled; late results of cancelled fetches are discarded. Returns
     * immediately: running fetches only receive a best-effort abort signal.
     */
    public synchronized void clear() {
        List<ScheduledTask> snapshot = new ArrayList<>(known.values());
        known.clear();
        running = 0;
        generation++;

        for (ScheduledTask task : snapshot) {
            task.cancel();
        }
        cancelledCount += snapshot.size();
        if (!snapshot.isEmpty()) {
            logger.debug("Cleared scheduler: {} tasks cancelled, generation {}", snapshot.size(), generation);
        }
    }

    // -- Internals ------------------------------------------------------------

    /** Highest positive-priority PENDING task; lowest sequence wins ties. Null if none. */
    private ScheduledTask selectNext() {
        ScheduledTask best = null;
        for (ScheduledTask task : known.values()) {
            if (!task.isStartable()) continue;
            if (best == null
                    || task.priority() > best.priority()
                    || (task.priority() == best.priority() && task.sequence() < best.sequence())) {
                best = task;
            }
        }
        return best;
    }

    private void start(ScheduledTask task) {
        task.markRunning();
        running++;
        startedCount++;
        if (running > peakRunning) {
            peakRunning = running;
        }
        logger.trace("Starting {} (priority {}, {} running)", task.tile().id(), task.priority(), running);

        CompletionStage<R> stage;
        try {
            stage = worker.start(task.tile());
            if (stage == null) {
                throw new IllegalStateException("TileWorker returned no stage for " + task.tile());
            }
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        task.attach(toFuture(stage));
        // may run synchronously when the stage is already complete; schedule() then
        // returns early and the enclosing fill loop takes the freed slot
        stage.whenComplete((result, failure) -> {
            try {
                settle(task, result, failure);
            } catch (RuntimeException e) {
                // nothing observes the stage returned by whenComplete
                logger.error("Settling task {} failed", task.tile().id(), e);
            }
        });
    }

    private synchronized void settle(ScheduledTask task, R result, Throwable failure) {
        if (task.status() != TaskStatus.RUNNING || task.generation() != generation) {
            logger.trace("Discarding result of cancelled task {}", task.tile().id());
            return;
        }

        boolean failed = failure != null;
        task.markSettled(failed);
        running--;
        known.remove(task.tile().id(), task);

        if (failed) {
            failedCount++;
            Throwable cause = unwrap(failure);
            logger.trace("Task {} failed: {}", task.tile().id(), cause.toString());
            notifyFailed(task.tile(), cause);
        } else {
            completedCount++;
            logger.trace("Task {} done", task.tile().id());
            notifyDone(task.tile(), result);
        }

        schedule();
    }

    private void notifyDone(Tile tile, R result) {
        try {
            worker.onDone(tile, result);
        } catch (RuntimeException e) {
            logger.warn("TileWorker.onDone threw for tile {}", tile.id(), e);
        }
    }

    private void notifyFailed(Tile tile, Throwable cause) {
        try {
            worker.onFailed(tile, cause);
        } catch (RuntimeException e) {
            logger.warn("TileWorker.onFailed threw for tile {}", tile.id(), e);
        }
    }

    private static CompletableFuture<?> toFuture(CompletionStage<?> stage) {
        try {
            return stage.toCompletableFuture();
        } catch (UnsupportedOperationException e) {
            // stage cannot be aborted; cancellation still discards its result
            return null;
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    // -- Inspection -----------------------------------------------------------

    /** Maximum number of RUNNING tasks. */
    public int concurrency() { return concurrency; }

    /** Number of tasks in the known set (PENDING + RUNNING). */
    public synchronized int knownCount() { return known.size(); }

    /** Number of RUNNING tasks. Never exceeds concurrency(). */
    public synchronized int runningCount() { return running; }

    /** Number of PENDING tasks, regardless of priority. */
    public synchronized int pendingCount() {
        int pending = 0;
        for (ScheduledTask task : known.values()) {
            if (task.status() == TaskStatus.PENDING) pending++;
        }
        return pending;
    }

    /** True if the tile has a PENDING or RUNNING task. */
    public synchronized boolean isKnown(Tile tile) {
        return known.containsKey(tile.id());
    }

    /** Task of a known tile, or null. For diagnostics; do not retain. */
    public synchronized ScheduledTask taskFor(Tile tile) {
        return known.get(tile.id());
    }

    /** Status of a known tile, or null if the tile is not in the known set. */
    public synchronized TaskStatus status(Tile tile) {
        ScheduledTask task = known.get(tile.id());
        return task == null ? null : task.status();
    }

    /** Snapshot of the known set in insertion order. */
    public synchronized List<ScheduledTask> snapshot() {
        return List.copyOf(known.values());
    }

    /** Number of clear() calls so far. Tasks from older generations are ignored. */
    public synchronized long generation() { return generation; }

    /** Cumulative number of fetches started. */
    public long startedCount() { return startedCount; }

    /** Cumulative number of tasks settled as DONE. */
    public long completedCount() { return completedCount; }

    /** Cumulative number of tasks settled as FAILED. */
    public long failedCount() { return failedCount; }

    /** Cumulative number of tasks CANCELLED by clear(). */
    public long cancelledCount() { return cancelledCount; }

    /** Highest RUNNING count ever observed. */
    public int peakRunning() { return peakRunning; }
}
