package io.dynamis.panorama.api;

/**
 * Destination of one tile inside the 8-way texture partition.
 *
 * The texture sink owns CANVAS_COUNT canvases; a tile is drawn into canvas
 * canvasIndex at pixel rectangle (x, y, width, height).
 *
 * The rectangle is in full-resolution panorama pixels. When the canvas side is
 * smaller than a quarter of the panorama width the sink scales by
 * canvasSize / (panoramaWidth / 4).
 */
public record CanvasRegion(
    int canvasIndex,
    int colInCanvas,
    int rowInCanvas,
    double x,
    double y,
    double width,
    double height
) {

    public CanvasRegion {
        if (canvasIndex < 0 || canvasIndex >= TilingConstants.CANVAS_COUNT) {
            throw new IllegalArgumentException(
                "canvasIndex must be in [0, " + TilingConstants.CANVAS_COUNT + "); got " + canvasIndex);
        }
    }
}
