package io.dynamis.panorama.core;

import io.dynamis.panorama.api.TaskStatus;
import io.dynamis.panorama.api.Tile;
import java.util.concurrent.CompletableFuture;

/**
 * One tile fetch tracked by a TileScheduler.
 *
 * Owned exclusively by the scheduler that created it. Mutable fields are written
 * only while that scheduler's lock is held; status is volatile so diagnostics may
 * read it from any thread.
 */
public final class ScheduledTask {

    private final Tile tile;
    private final long sequence;
    private final long generation;

    private double priority;
    private volatile TaskStatus status = TaskStatus.PENDING;

    /** Stage of the running fetch, kept only to forward a best-effort abort on cancel(). */
    private CompletableFuture<?> inFlight;

    ScheduledTask(Tile tile, double priority, long sequence, long generation) {
        this.tile = tile;
        this.priority = priority;
        this.sequence = sequence;
        this.generation = generation;
    }

    public Tile tile() { return tile; }

    /** Current priority. Higher is more urgent; only tasks with priority > 0 are started. */
    public double priority() { return priority; }

    public TaskStatus status() { return status; }

    /** Insertion order within the owning scheduler. Lower wins priority ties. */
    public long sequence() { return sequence; }

    /** Scheduler generation this task was created in. */
    public long generation() { return generation; }

    void setPriority(double priority) {
        this.priority = priority;
    }

    boolean isStartable() {
        return status == TaskStatus.PENDING && priority > 0.0;
    }

    void markRunning() {
        this.status = TaskStatus.RUNNING;
    }

    void attach(CompletableFuture<?> future) {
        this.inFlight = future;
    }

    void markSettled(boolean failed) {
        this.status = failed ? TaskStatus.FAILED : TaskStatus.DONE;
        this.inFlight = null;
    }

    /**
     * Marks the task CANCELLED, then signals the running fetch (if any) to abort.
     * The status is written first so a completion triggered by the abort sees it.
     */
    void cancel() {
        this.status = TaskStatus.CANCELLED;
        CompletableFuture<?> future = inFlight;
        inFlight = null;
        if (future != null) {
            future.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "ScheduledTask{" + tile.id() + ", priority=" + priority + ", status=" + status + "}";
    }
}
