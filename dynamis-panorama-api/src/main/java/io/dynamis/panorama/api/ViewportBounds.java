package io.dynamis.panorama.api;

/**
 * Size of the viewer in pixels. A screen point is on screen when it lies
 * inside [0, width] x [0, height], edges included.
 */
public record ViewportBounds(double width, double height) {

    public ViewportBounds {
        if (width < 0 || height < 0 || Double.isNaN(width) || Double.isNaN(height)) {
            throw new IllegalArgumentException(
                "viewport size must be non-negative; got " + width + "x" + height);
        }
    }

    public boolean contains(ScreenPoint point) {
        return point.x() >= 0 && point.x() <= width
            && point.y() >= 0 && point.y() <= height;
    }
}
