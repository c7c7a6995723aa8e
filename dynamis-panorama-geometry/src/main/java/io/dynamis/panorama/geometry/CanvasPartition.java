package io.dynamis.panorama.geometry;

import io.dynamis.panorama.api.CanvasRegion;
import io.dynamis.panorama.api.PanoramaConfig;
import io.dynamis.panorama.api.SourceRegion;
import io.dynamis.panorama.api.Tile;
import io.dynamis.panorama.api.TilingConstants;

/**
 * Layout of the 8-way texture partition used by the texture sink.
 *
 * The panorama is split into 4 longitude bands x 2 hemispheres. Canvases are
 * indexed band-major, with the band order reversed relative to texture columns
 * because the sphere mesh is mirrored on X:
 *
 *   canvas = floor((cols - 1 - col) / cols * 4) * 2 + (row >= rows / 2 ? 1 : 0)
 *
 * Even indices hold the northern hemisphere, odd indices the southern one.
 */
public final class CanvasPartition {

    private CanvasPartition() {}

    /** Canvas holding the given tile, in [0, CANVAS_COUNT). */
    public static int canvasIndex(Tile tile, PanoramaConfig config) {
        int cols = config.cols();
        int band = (int) Math.floor((double) (cols - 1 - tile.col()) / cols * TilingConstants.CANVAS_COLUMNS);
        int index = band * TilingConstants.CANVAS_ROWS;
        if (tile.row() >= config.rows() / TilingConstants.CANVAS_ROWS) {
            index++;
        }
        return index;
    }

    /** Full destination of a tile: canvas index, cell within the canvas and pixel rectangle. */
    public static CanvasRegion locate(Tile tile, PanoramaConfig config) {
        int colsPerCanvas = config.cols() / TilingConstants.CANVAS_COLUMNS;
        int rowsPerCanvas = config.rows() / TilingConstants.CANVAS_ROWS;
        int colInCanvas = tile.col() % colsPerCanvas;
        int rowInCanvas = tile.row() % rowsPerCanvas;
        double colSize = config.colSize();
        double rowSize = config.rowSize();
        return new CanvasRegion(
            canvasIndex(tile, config),
            colInCanvas,
            rowInCanvas,
            colInCanvas * colSize,
            rowInCanvas * rowSize,
            colSize,
            rowSize);
    }

    /**
     * Side length of each square canvas: min(width / 4, maxCanvasWidth / 2).
     *
     * @throws IllegalArgumentException if maxCanvasWidth < 2
     */
    public static int canvasSize(int panoramaWidth, int maxCanvasWidth) {
        if (maxCanvasWidth < 2) {
            throw new IllegalArgumentException("maxCanvasWidth must be >= 2; got " + maxCanvasWidth);
        }
        return Math.min(panoramaWidth / TilingConstants.CANVAS_COLUMNS, maxCanvasWidth / 2);
    }

    /**
     * Rectangle of a low resolution base image that belongs in canvas canvasIndex.
     * Pass 1.0 for both sizes to get fractions of the image.
     *
     * @return region in the units of imageWidth / imageHeight
     */
    public static SourceRegion baseSourceRegion(int canvasIndex, double imageWidth, double imageHeight) {
        if (canvasIndex < 0 || canvasIndex >= TilingConstants.CANVAS_COUNT) {
            throw new IllegalArgumentException(
                "canvasIndex must be in [0, " + TilingConstants.CANVAS_COUNT + "); got " + canvasIndex);
        }
        int band = (TilingConstants.CANVAS_COUNT - 1 - canvasIndex) / TilingConstants.CANVAS_ROWS;
        int hemisphere = canvasIndex % TilingConstants.CANVAS_ROWS;
        double w = imageWidth / TilingConstants.CANVAS_COLUMNS;
        double h = imageHeight / TilingConstants.CANVAS_ROWS;
        return new SourceRegion(band * w, hemisphere * h, w, h);
    }
}
