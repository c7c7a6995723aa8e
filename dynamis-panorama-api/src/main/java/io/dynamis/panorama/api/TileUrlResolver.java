package io.dynamis.panorama.api;

/**
 * Builds the fetch key of one tile.
 *
 * The key is opaque to the core; it is handed unchanged to the TileFetcher.
 * Typically a URL such as "https://example.org/pano/tile_" + col + "x" + row + ".jpg".
 */
@FunctionalInterface
public interface TileUrlResolver {

    /**
     * @param col wrapped column in [0, cols)
     * @param row wrapped row in [0, rows)
     * @return fetch key; must not be null
     */
    String resolve(int col, int row);
}
