package io.dynamis.panorama.core;

import io.dynamis.panorama.api.Tile;
import java.util.concurrent.CompletionStage;

/**
 * The work a TileScheduler performs for each task it starts.
 *
 * start() is called with the scheduler lock held and must return without blocking.
 * onDone() / onFailed() are called exactly once per settled task that was not
 * cancelled, also with the scheduler lock held: a clear() can never slip in between
 * the cancellation check and the notification, so results of a cleared panorama
 * never reach the texture of the next one.
 *
 * @param <R> result type of a successful fetch
 */
public interface TileWorker<R> {

    /**
     * Begins fetching a tile.
     * Throwing is treated the same as returning an exceptionally completed stage.
     */
    CompletionStage<R> start(Tile tile);

    /** The tile's fetch completed normally. */
    void onDone(Tile tile, R result);

    /** The tile's fetch failed. cause is never a CompletionException wrapper. */
    void onFailed(Tile tile, Throwable cause);
}
