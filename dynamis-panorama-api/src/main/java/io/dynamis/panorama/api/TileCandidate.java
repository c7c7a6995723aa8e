package io.dynamis.panorama.api;

/**
 * A tile proposed for loading, with its angular distance from the view center.
 *
 * @param tile  the candidate tile; must not be null
 * @param angle angle in radians between the view direction and the closest visible
 *              corner of the tile. Smaller is more urgent.
 */
public record TileCandidate(Tile tile, double angle) {

    public TileCandidate {
        if (tile == null) throw new NullPointerException("tile");
        if (Double.isNaN(angle)) {
            throw new IllegalArgumentException("angle must not be NaN for " + tile);
        }
    }

    /** Fetch priority for this candidate: MAX_USEFUL_ANGLE - angle. */
    public double priority() {
        return TilingConstants.MAX_USEFUL_ANGLE - angle;
    }
}
