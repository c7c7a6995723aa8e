package io.dynamis.panorama.api;

/**
 * Receives decoded tiles and composes them into the 8-way texture partition.
 *
 * Called once per settled tile fetch: drawTile() on success, drawPlaceholder() on
 * failure, each followed by markCanvasDirty() for the affected canvas.
 * The core guarantees at most one fetch in flight per tile, so two calls never
 * target the same CanvasRegion concurrently. Calls for different tiles may arrive
 * on different threads; a sink sharing one physical buffer across canvases must
 * serialise its own writes.
 *
 * @param <I> decoded image type produced by the matching TileFetcher
 */
public interface TileTextureSink<I> {

    /**
     * Called once per panorama load, before any other method for that panorama.
     * Implementations (re)create CANVAS_COUNT canvases of canvasSize x canvasSize pixels.
     */
    void prepare(PanoramaConfig config, int canvasSize);

    /**
     * Draws one canvas worth of the low resolution base panorama.
     * Called once per canvas, only when the panorama declares a base URL.
     *
     * @param canvasIndex  target canvas, in [0, CANVAS_COUNT)
     * @param sourceRegion part of the image to stretch over the whole canvas, in
     *                     fractions of the image size (see SourceRegion.scale)
     */
    void drawBase(int canvasIndex, SourceRegion sourceRegion, I image);

    /** Draws a decoded tile into its region. */
    void drawTile(Tile tile, CanvasRegion region, I image);

    /** Draws an error placeholder for a tile whose fetch failed. */
    void drawPlaceholder(Tile tile, CanvasRegion region, Throwable cause);

    /** Signals that canvas canvasIndex changed and its texture must be re-uploaded. */
    void markCanvasDirty(int canvasIndex);
}
