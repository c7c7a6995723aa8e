package io.dynamis.panorama.api;

/**
 * Lifecycle states of a scheduled tile fetch.
 *
 * Valid transitions:
 *   PENDING  -> RUNNING    (selected for a free slot with priority > 0)
 *   RUNNING  -> DONE       (fetch succeeded)
 *   RUNNING  -> FAILED     (fetch failed)
 *   PENDING  -> CANCELLED  (scheduler cleared)
 *   RUNNING  -> CANCELLED  (scheduler cleared; late result discarded)
 *
 * DONE, FAILED and CANCELLED are terminal. A task in a terminal state is no
 * longer in the scheduler's known set.
 */
public enum TaskStatus {

    /** Known, waiting for a slot. Only started while its priority is > 0. */
    PENDING,

    /** Occupies one concurrency slot. Never preempted by priority changes. */
    RUNNING,

    /** Dropped by a clear(). Any result that still arrives is ignored. */
    CANCELLED,

    /** Fetch delivered an image to the texture sink. */
    DONE,

    /** Fetch failed; the texture sink drew a placeholder. */
    FAILED;

    /** True for DONE, FAILED and CANCELLED. */
    public boolean isTerminal() {
        return this == CANCELLED || this == DONE || this == FAILED;
    }
}
