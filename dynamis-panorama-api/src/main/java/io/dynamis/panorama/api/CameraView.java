package io.dynamis.panorama.api;

/**
 * Read-only camera state for one refresh cycle.
 *
 * Captured by the viewer on every direction or zoom change and handed to the
 * loader. The projection reflects the current zoom / field of view, so a zoom
 * change with an unchanged direction still yields a different visible set.
 *
 * @param direction  unit view direction
 * @param bounds     viewer size in pixels
 * @param projection maps a direction to viewer pixels under the current camera
 */
public record CameraView(Direction direction, ViewportBounds bounds, ViewerProjection projection) {

    public CameraView {
        if (direction == null) throw new NullPointerException("direction");
        if (bounds == null) throw new NullPointerException("bounds");
        if (projection == null) throw new NullPointerException("projection");
    }
}
