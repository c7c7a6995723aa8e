package io.dynamis.panorama.api;

/**
 * Description of a loaded tiled panorama, returned once the texture is ready
 * to receive tiles. Tiled panoramas are never cropped, so the cropped size
 * equals the full size and the crop offset is zero.
 */
public record PanoramaData(
    int fullWidth,
    int fullHeight,
    int croppedWidth,
    int croppedHeight,
    int croppedX,
    int croppedY,
    int canvasCount,
    int canvasSize
) {

    /** Builds the uncropped description of a tiled panorama. */
    public static PanoramaData uncropped(PanoramaConfig config, int canvasSize) {
        return new PanoramaData(
            config.width(), config.height(),
            config.width(), config.height(),
            0, 0,
            TilingConstants.CANVAS_COUNT, canvasSize);
    }
}
