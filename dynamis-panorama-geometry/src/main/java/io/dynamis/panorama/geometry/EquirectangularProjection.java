package io.dynamis.panorama.geometry;

import io.dynamis.panorama.api.Direction;
import io.dynamis.panorama.api.PanoramaConfig;

/**
 * Conversions between texture pixels, spherical coordinates and 3D directions.
 *
 * Standard equirectangular mapping: x is linear in longitude, y is linear in latitude.
 * The horizontal texture center faces longitude 0 (+Z); the left and right texture
 * edges meet at longitude PI. Y is up.
 *
 * All methods are static and side-effect free.
 */
public final class EquirectangularProjection {

    private static final double TWO_PI = Math.PI * 2;

    private EquirectangularProjection() {}

    /**
     * @param x texture x in pixels, [0, width]
     * @param y texture y in pixels, [0, height]
     */
    public static SphericalPosition textureCoordsToSpherical(double x, double y, PanoramaConfig config) {
        double relativeX = x / config.width() * TWO_PI;
        double relativeY = y / config.height() * Math.PI;
        double longitude = relativeX >= Math.PI ? relativeX - Math.PI : relativeX + Math.PI;
        double latitude = Math.PI / 2 - relativeY;
        return new SphericalPosition(longitude, latitude);
    }

    /** Unit direction of a spherical position. */
    public static Direction sphericalToDirection(SphericalPosition position) {
        double cosLat = Math.cos(position.latitude());
        return new Direction(
            -cosLat * Math.sin(position.longitude()),
            Math.sin(position.latitude()),
            cosLat * Math.cos(position.longitude()));
    }

    /** Unit direction of a texture point. */
    public static Direction textureCoordsToDirection(double x, double y, PanoramaConfig config) {
        return sphericalToDirection(textureCoordsToSpherical(x, y, config));
    }

    /** Spherical position of a direction. Zero vectors map to (0, 0). */
    public static SphericalPosition directionToSpherical(Direction direction) {
        Direction unit = direction.normalize();
        if (unit.length() == 0.0) {
            return new SphericalPosition(0.0, 0.0);
        }
        double latitude = Math.asin(Math.max(-1.0, Math.min(1.0, unit.y())));
        double longitude = Math.atan2(-unit.x(), unit.z());
        if (longitude < 0) {
            longitude += TWO_PI;
        }
        return new SphericalPosition(longitude, latitude);
    }

    /** Angle between two directions in radians, [0, PI]. */
    public static double angleBetween(Direction a, Direction b) {
        return a.angleTo(b);
    }
}
