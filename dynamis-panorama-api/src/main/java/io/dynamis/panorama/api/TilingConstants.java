package io.dynamis.panorama.api;

/**
 * Global constants for the tiled panorama streaming core.
 *
 * These values are shared by the geometry, sampler and scheduler layers.
 * The canvas partition constants are tied to the grid multiples: a panorama
 * must split evenly into CANVAS_COLUMNS longitude bands and CANVAS_ROWS hemispheres
 * so that every canvas boundary falls on a tile boundary.
 */
public final class TilingConstants {

    private TilingConstants() {}

    // -- Grid model -----------------------------------------------------------

    /** Column count of every tiled panorama must be a multiple of this value. */
    public static final int COLUMN_MULTIPLE = 4;

    /** Row count of every tiled panorama must be a multiple of this value. */
    public static final int ROW_MULTIPLE = 2;

    /** Height of an equirectangular panorama is always width / HEIGHT_RATIO. */
    public static final int HEIGHT_RATIO = 2;

    // -- Canvas partition -----------------------------------------------------

    /** Longitude bands of the texture partition. One band covers 90 degrees. */
    public static final int CANVAS_COLUMNS = 4;

    /** Hemispheres of the texture partition (north, south). */
    public static final int CANVAS_ROWS = 2;

    /** Total canvases the texture sink must provide. LOCKED at 8. */
    public static final int CANVAS_COUNT = CANVAS_COLUMNS * CANVAS_ROWS;

    /**
     * Default upper bound for a single canvas side, in pixels.
     * Canvas side = min(width / 4, maxCanvasWidth / 2).
     */
    public static final int DEFAULT_MAX_CANVAS_WIDTH = 8_192;

    // -- Scheduling -----------------------------------------------------------

    /** Default number of tile fetches allowed in flight at once. */
    public static final int DEFAULT_FETCH_CONCURRENCY = 2;

    /**
     * Angle from the view center at which a tile stops being worth fetching.
     * Priority = MAX_USEFUL_ANGLE - angle, so tiles at or beyond this angle score <= 0.
     */
    public static final double MAX_USEFUL_ANGLE = Math.PI / 2;

    /**
     * Priority assigned to every known task at the start of a submit cycle.
     * Tiles not seen again in that cycle keep this value and are never newly started.
     * Must be <= 0.
     */
    public static final double DEMOTED_PRIORITY = 0.0;

    // -- Validation -----------------------------------------------------------

    /**
     * Verifies internal consistency of constants.
     * Throws IllegalStateException if any invariant is violated.
     */
    public static void validate() {
        if (COLUMN_MULTIPLE % CANVAS_COLUMNS != 0) {
            throw new IllegalStateException(
                "COLUMN_MULTIPLE " + COLUMN_MULTIPLE +
                " must be a multiple of CANVAS_COLUMNS " + CANVAS_COLUMNS);
        }
        if (ROW_MULTIPLE % CANVAS_ROWS != 0) {
            throw new IllegalStateException(
                "ROW_MULTIPLE " + ROW_MULTIPLE + " must be a multiple of CANVAS_ROWS " + CANVAS_ROWS);
        }
        if (DEMOTED_PRIORITY > 0.0) {
            throw new IllegalStateException(
                "DEMOTED_PRIORITY must be <= 0; actual = " + DEMOTED_PRIORITY);
        }
        if (DEFAULT_FETCH_CONCURRENCY < 1) {
            throw new IllegalStateException("DEFAULT_FETCH_CONCURRENCY must be >= 1");
        }
    }

    static {
        validate();
    }
}
