package io.dynamis.panorama.api;

/**
 * A 3D direction from the sphere center. Y is up; longitude 0 faces +Z.
 *
 * Directions produced by the geometry layer are unit length. Camera directions
 * supplied by the viewer are expected to be unit length as well; angleTo()
 * normalises internally, dot() does not.
 */
public record Direction(double x, double y, double z) {

    public double dot(Direction other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    /**
     * Angle between this direction and another, in radians [0..PI].
     * Returns PI / 2 if either direction has zero length.
     */
    public double angleTo(Direction other) {
        double denominator = length() * other.length();
        if (denominator == 0.0) {
            return Math.PI / 2;
        }
        double cos = dot(other) / denominator;
        // clamp: rounding can push |cos| slightly above 1
        return Math.acos(Math.max(-1.0, Math.min(1.0, cos)));
    }

    /** Returns this direction scaled to unit length. Zero vectors are returned unchanged. */
    public Direction normalize() {
        double len = length();
        if (len == 0.0 || len == 1.0) {
            return this;
        }
        return new Direction(x / len, y / len, z / len);
    }
}
