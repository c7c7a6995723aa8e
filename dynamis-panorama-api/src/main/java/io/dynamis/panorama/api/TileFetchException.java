package io.dynamis.panorama.api;

/**
 * Thrown, or used as a failure cause, when one image fetch fails.
 *
 * Local to a single task: the tile is reported to the texture sink as a
 * placeholder and may be retried when it becomes visible again.
 * Also used when the base image of a panorama cannot be fetched, in which
 * case tile is null.
 */
public final class TileFetchException extends RuntimeException {

    private final String fetchKey;
    private final Tile tile;

    public TileFetchException(String fetchKey, Tile tile, Throwable cause) {
        super(describe(fetchKey, tile, cause), cause);
        this.fetchKey = fetchKey;
        this.tile = tile;
    }

    public TileFetchException(String fetchKey, Throwable cause) {
        this(fetchKey, null, cause);
    }

    /** Key that was handed to the fetcher. */
    public String fetchKey() { return fetchKey; }

    /** Tile being fetched, or null for the base image. */
    public Tile tile() { return tile; }

    private static String describe(String fetchKey, Tile tile, Throwable cause) {
        String what = tile == null ? "base image" : "tile " + tile.id();
        String reason = cause == null ? "unknown cause" : String.valueOf(cause.getMessage());
        return "Failed to fetch " + what + " from '" + fetchKey + "': " + reason;
    }
}
