package io.dynamis.panorama.api;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous image fetch primitive (network + decode).
 *
 * Implementations must not block the calling thread: the scheduler calls fetch()
 * while it holds its own lock. The returned stage completes normally with the
 * decoded image or exceptionally with the failure cause.
 *
 * CANCELLATION:
 *   When the scheduler is cleared it calls toCompletableFuture().cancel(false) on
 *   the stages of running fetches. Implementations may honour that as an abort
 *   signal; the scheduler does not depend on it.
 *
 * @param <I> decoded image type, opaque to the core
 */
@FunctionalInterface
public interface TileFetcher<I> {

    /**
     * @param fetchKey key produced by the panorama's TileUrlResolver, or its base URL
     * @return stage completing with the decoded image
     */
    CompletionStage<I> fetch(String fetchKey);
}
