package io.dynamis.panorama.core;

import io.dynamis.panorama.api.CameraView;
import io.dynamis.panorama.api.CanvasRegion;
import io.dynamis.panorama.api.PanoramaConfig;
import io.dynamis.panorama.api.PanoramaConfigurationException;
import io.dynamis.panorama.api.PanoramaData;
import io.dynamis.panorama.api.RedrawRequester;
import io.dynamis.panorama.api.SourceRegion;
import io.dynamis.panorama.api.Tile;
import io.dynamis.panorama.api.TileCandidate;
import io.dynamis.panorama.api.TileFetchException;
import io.dynamis.panorama.api.TileFetcher;
import io.dynamis.panorama.api.TileTextureSink;
import io.dynamis.panorama.api.TilingConstants;
import io.dynamis.panorama.geometry.CanvasPartition;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams a tiled equirectangular panorama into an 8-way texture partition.
 *
 * Owned by the viewer. Wires a VisibilitySampler and a TileScheduler to the
 * viewer-supplied fetch, texture and redraw collaborators.
 *
 * PROTOCOL:
 *   1. loadTexture(config) - cancels all work of the previous panorama, prepares the
 *      sink, draws the optional low resolution base image. The returned future
 *      completes once the texture is ready to receive tiles.
 *   2. refresh(view) - called by the viewer on every direction or zoom change,
 *      at most once per frame. Recomputes the visible tiles and resubmits those
 *      not yet drawn for the current load. Ignored until the current load is ready.
 *   3. destroy() - cancels all work. The loader may be reused with loadTexture().
 *
 * Every settled tile ends in the sink: drawTile() on success, drawPlaceholder() on
 * failure, then markCanvasDirty() and a redraw request. Collaborator exceptions
 * are logged and never reach the scheduler.
 *
 * THREAD SAFETY:
 *   loadTexture(), refresh() and destroy() are serialised on this loader.
 *   Lock order is loader then scheduler; scheduler callbacks never take the loader lock.
 *
 * @param <I> decoded image type shared by the fetcher and the sink
 */
public final class TiledPanoramaLoader<I> {

    private static final Logger logger = LoggerFactory.getLogger(TiledPanoramaLoader.class);

    // -- Collaborators --------------------------------------------------------

    private final TileFetcher<I> fetcher;
    private final TileTextureSink<I> sink;
    private final RedrawRequester redrawRequester;
    private final LoaderOptions options;

    private final VisibilitySampler sampler = new VisibilitySampler();
    private final TileScheduler<I> scheduler;

    // -- Panorama state -------------------------------------------------------

    /** Current panorama. Null before the first load and after destroy(). */
    private volatile PanoramaConfig config;
    private volatile int canvasSize = 0;
    private volatile boolean ready = false;

    /** Incremented by every loadTexture() and destroy(). Guarded by this. */
    private long loadGeneration = 0L;

    /**
     * Ids of tiles drawn for the current load. Failed tiles are not recorded, so
     * they are fetched again when they become visible again.
     * Written by scheduler callbacks, read by refresh().
     */
    private final Set<String> drawnTiles = ConcurrentHashMap.newKeySet();

    // -- Construction ---------------------------------------------------------

    public TiledPanoramaLoader(TileFetcher<I> fetcher,
                               TileTextureSink<I> sink,
                               RedrawRequester redrawRequester,
                               LoaderOptions options) {
        if (fetcher == null) throw new NullPointerException("fetcher");
        if (sink == null) throw new NullPointerException("sink");
        if (redrawRequester == null) throw new NullPointerException("redrawRequester");
        if (options == null) throw new NullPointerException("options");
        this.fetcher = fetcher;
        this.sink = sink;
        this.redrawRequester = redrawRequester;
        this.options = options;
        this.scheduler = new TileScheduler<>(new TileLoadWorker(), options.fetchConcurrency());
    }

    /** Constructs with LoaderOptions.defaults(). */
    public TiledPanoramaLoader(TileFetcher<I> fetcher, TileTextureSink<I> sink, RedrawRequester redrawRequester) {
        this(fetcher, sink, redrawRequester, LoaderOptions.defaults());
    }

    // -- Panorama lifecycle ---------------------------------------------------

    /**
     * Switches to a new panorama.
     *
     * All tasks of the previous panorama are cancelled before the new config is
     * installed, so none of their results can reach the new texture.
     *
     * @param panorama validated configuration (see PanoramaConfig.builder())
     * @return future completing with the texture description once the base image,
     *         if any, is drawn. Fails with PanoramaConfigurationException if panorama
     *         is null, or TileFetchException if the base image cannot be fetched.
     */
    public synchronized CompletableFuture<PanoramaData> loadTexture(PanoramaConfig panorama) {
        if (panorama == null) {
            return CompletableFuture.failedFuture(new PanoramaConfigurationException(
                "Invalid panorama configuration: a tiled panorama config is required"));
        }

        scheduler.clear();
        sampler.reset();
        drawnTiles.clear();
        long load = ++loadGeneration;
        ready = false;
        config = panorama;
        canvasSize = CanvasPartition.canvasSize(panorama.width(), options.maxCanvasWidth());
        PanoramaData data = PanoramaData.uncropped(panorama, canvasSize);

        logger.info("Loading tiled panorama {} (canvas {}px)", panorama, canvasSize);

        try {
            sink.prepare(panorama, canvasSize);
        } catch (RuntimeException e) {
            config = null;
            logger.warn("Texture sink failed to prepare canvases for {}", panorama, e);
            return CompletableFuture.failedFuture(e);
        }

        if (!panorama.hasBaseUrl()) {
            ready = true;
            return CompletableFuture.completedFuture(data);
        }

        String baseUrl = panorama.baseUrl();
        CompletionStage<I> stage;
        try {
            stage = fetcher.fetch(baseUrl);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        return stage
            .handle((image, failure) -> onBaseSettled(load, baseUrl, image, failure, data))
            .toCompletableFuture();
    }

    /**
     * Recomputes the visible tiles from the given camera state and resubmits them.
     * No-op while no panorama is loaded or the current load is not ready yet.
     */
    public synchronized void refresh(CameraView view) {
        if (view == null) throw new NullPointerException("view");
        PanoramaConfig current = config;
        if (current == null || !ready) {
            logger.debug("Refresh ignored: no panorama ready");
            return;
        }
        List<TileCandidate> visible = sampler.computeVisibleTiles(view, current);
        List<TileCandidate> candidates = new ArrayList<>(visible.size());
        for (TileCandidate candidate : visible) {
            if (!drawnTiles.contains(candidate.tile().id())) {
                candidates.add(candidate);
            }
        }
        scheduler.submit(candidates);
    }

    /** Cancels all work and forgets the current panorama. */
    public synchronized void destroy() {
        scheduler.clear();
        sampler.reset();
        drawnTiles.clear();
        loadGeneration++;
        ready = false;
        config = null;
        canvasSize = 0;
    }

    private synchronized PanoramaData onBaseSettled(long load, String baseUrl, I image,
                                                    Throwable failure, PanoramaData data) {
        if (load != loadGeneration) {
            logger.debug("Discarding base image '{}' of a superseded load", baseUrl);
            return data;
        }
        if (failure != null) {
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause() : failure;
            logger.warn("Failed to load base image '{}'", baseUrl, cause);
            throw new CompletionException(new TileFetchException(baseUrl, cause));
        }

        for (int i = 0; i < TilingConstants.CANVAS_COUNT; i++) {
            SourceRegion region = CanvasPartition.baseSourceRegion(i, 1.0, 1.0);
            try {
                sink.drawBase(i, region, image);
            } catch (RuntimeException e) {
                logger.warn("Texture sink failed to draw base image '{}' into canvas {}", baseUrl, i, e);
            }
            markDirty(i);
        }
        requestRedraw();
        ready = true;
        return data;
    }

    // -- Inspection -----------------------------------------------------------

    /** Current panorama, or null. */
    public PanoramaConfig currentConfig() { return config; }

    /** True once the current load completed and refresh() is accepted. */
    public boolean isReady() { return ready; }

    /** Number of tiles drawn for the current load. */
    public int drawnTileCount() { return drawnTiles.size(); }

    /** True if the tile was drawn for the current load and will not be fetched again. */
    public boolean isDrawn(Tile tile) { return drawnTiles.contains(tile.id()); }

    /** Side of each canvas of the current panorama, 0 when none is loaded. */
    public int canvasSize() { return canvasSize; }

    public LoaderOptions options() { return options; }

    /** The scheduler driving tile fetches. Exposed for diagnostics and tests. */
    public TileScheduler<I> scheduler() { return scheduler; }

    /** The sampler computing visible tiles. Exposed for diagnostics and tests. */
    public VisibilitySampler sampler() { return sampler; }

    // -- Collaborator calls ---------------------------------------------------

    private void markDirty(int canvasIndex) {
        try {
            sink.markCanvasDirty(canvasIndex);
        } catch (RuntimeException e) {
            logger.warn("Texture sink failed to mark canvas {} dirty", canvasIndex, e);
        }
    }

    private void requestRedraw() {
        try {
            redrawRequester.requestRedraw();
        } catch (RuntimeException e) {
            logger.warn("Redraw request failed", e);
        }
    }

    private PanoramaConfig requireConfig() {
        PanoramaConfig current = config;
        if (current == null) {
            throw new IllegalStateException("No panorama loaded");
        }
        return current;
    }

    // -- Tile work ------------------------------------------------------------

    /** Fetches a tile and hands the outcome to the texture sink. */
    private final class TileLoadWorker implements TileWorker<I> {

        @Override
        public CompletionStage<I> start(Tile tile) {
            String url = requireConfig().tileUrl(tile);
            logger.trace("Fetching tile {} from '{}'", tile.id(), url);
            return fetcher.fetch(url);
        }

        @Override
        public void onDone(Tile tile, I image) {
            CanvasRegion region = CanvasPartition.locate(tile, requireConfig());
            try {
                sink.drawTile(tile, region, image);
            } catch (RuntimeException e) {
                logger.warn("Texture sink failed to draw tile {}", tile.id(), e);
            }
            drawnTiles.add(tile.id());
            markDirty(region.canvasIndex());
            requestRedraw();
        }

        @Override
        public void onFailed(Tile tile, Throwable cause) {
            PanoramaConfig current = requireConfig();
            CanvasRegion region = CanvasPartition.locate(tile, current);
            TileFetchException error = cause instanceof TileFetchException tfe
                ? tfe : new TileFetchException(current.tileUrl(tile), tile, cause);
            logger.warn(error.getMessage());
            try {
                sink.drawPlaceholder(tile, region, error);
            } catch (RuntimeException e) {
                logger.warn("Texture sink failed to draw placeholder for tile {}", tile.id(), e);
            }
            markDirty(region.canvasIndex());
            requestRedraw();
        }
    }
}
