package io.dynamis.panorama.api;

/**
 * Rectangle of a source image to copy into one canvas.
 *
 * The loader hands the sink regions in fractions of the image size (the image
 * is opaque to the core); scale() converts them to image pixels.
 */
public record SourceRegion(double x, double y, double width, double height) {

    /** This region with x and width multiplied by sx, y and height by sy. */
    public SourceRegion scale(double sx, double sy) {
        return new SourceRegion(x * sx, y * sy, width * sx, height * sy);
    }
}
