package io.dynamis.panorama.api;

/**
 * Address of one rectangular slice of the panorama image.
 *
 * Coordinates are always wrapped into the grid: col in [0, cols), row in [0, rows).
 * Two tiles with the same (col, row) are the same tile; id() is the canonical
 * string form used as the scheduler's deduplication key.
 */
public record Tile(int col, int row) {

    public Tile {
        if (col < 0 || row < 0) {
            throw new IllegalArgumentException(
                "tile coordinates must be wrapped into the grid; got " + col + "x" + row);
        }
    }

    /** Canonical id, "<col>x<row>". */
    public String id() {
        return col + "x" + row;
    }

    @Override
    public String toString() {
        return "Tile{" + id() + "}";
    }
}
