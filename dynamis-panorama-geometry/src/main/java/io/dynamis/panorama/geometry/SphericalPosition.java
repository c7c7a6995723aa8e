package io.dynamis.panorama.geometry;

/**
 * Position on the panorama sphere.
 *
 * @param longitude radians in [0, 2*PI); 0 faces +Z
 * @param latitude  radians in [-PI/2, PI/2]; PI/2 is the north pole
 */
public record SphericalPosition(double longitude, double latitude) {}
