package io.dynamis.panorama.api;

/**
 * Projects a direction on the unit sphere to viewer pixels.
 *
 * Supplied by the viewer; depends on the camera orientation, lens and zoom.
 * Only called for directions in the front hemisphere of the current view.
 */
@FunctionalInterface
public interface ViewerProjection {

    ScreenPoint project(Direction direction);
}
