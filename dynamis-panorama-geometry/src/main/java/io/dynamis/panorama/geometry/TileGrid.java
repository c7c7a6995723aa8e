package io.dynamis.panorama.geometry;

import io.dynamis.panorama.api.PanoramaConfig;
import io.dynamis.panorama.api.Tile;
import java.util.List;

/**
 * Stateless tile grid arithmetic for tiled equirectangular panoramas.
 *
 * The grid is a torus in longitude and reflects across the poles in latitude:
 * stepping above row 0 lands on row 0 of the antipodal column band, stepping
 * below the last row lands on the last row of the antipodal band.
 *
 * WRAP RULES (cols=16, rows=8):
 *   row -1 -> row 0, col + 8        row -2 -> row 1, col + 8
 *   row  8 -> row 7, col + 8        row  9 -> row 6, col + 8
 *   col -1 -> col 15                col 16 -> col 0
 *   Row and column wrap are applied independently; the column wrap also applies
 *   to a column that was just shifted by a pole crossing.
 */
public final class TileGrid {

    private TileGrid() {}

    /** Size of one tile of the given panorama. */
    public static TileSize tileSize(PanoramaConfig config) {
        return new TileSize(config.colSize(), config.rowSize());
    }

    /**
     * Wraps a raw (col, row) pair into the grid.
     *
     * Handles one step past the poles and one full turn in longitude, which covers
     * every neighbour of a grid corner.
     */
    public static Tile wrap(int col, int row, PanoramaConfig config) {
        int cols = config.cols();
        int rows = config.rows();

        if (row < 0) {
            // wrap on top: -1 => 0, -2 => 1
            row = -row - 1;
            col += cols / 2;
        } else if (row >= rows) {
            // wrap on bottom: rows => rows-1, rows+1 => rows-2
            row = (rows - 1) - (row - rows);
            col += cols / 2;
        }

        if (col < 0) {
            col += cols;
        } else if (col >= cols) {
            col -= cols;
        }
        return new Tile(col, row);
    }

    /**
     * Returns the 4 tiles sharing the grid corner (col, row).
     *
     * Order: top-left (col-1, row-1), top-right (col, row-1),
     * bottom-right (col, row), bottom-left (col-1, row), each wrapped.
     * At a pole corner two entries may wrap onto the same tile; callers merge by id.
     *
     * @param col corner column in [0, cols]
     * @param row corner row in [0, rows]
     */
    public static List<Tile> adjacentTiles(int col, int row, PanoramaConfig config) {
        return List.of(
            wrap(col - 1, row - 1, config),
            wrap(col, row - 1, config),
            wrap(col, row, config),
            wrap(col - 1, row, config)
        );
    }

    /** True if (col, row) already lies inside the grid. */
    public static boolean contains(int col, int row, PanoramaConfig config) {
        return col >= 0 && col < config.cols() && row >= 0 && row < config.rows();
    }

    /** Total number of tiles in the grid. */
    public static int tileCount(PanoramaConfig config) {
        return config.cols() * config.rows();
    }
}
