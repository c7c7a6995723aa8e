package io.dynamis.panorama.core;

import io.dynamis.panorama.api.CameraView;
import io.dynamis.panorama.api.Direction;
import io.dynamis.panorama.api.PanoramaConfig;
import io.dynamis.panorama.api.ScreenPoint;
import io.dynamis.panorama.api.Tile;
import io.dynamis.panorama.api.TileCandidate;
import io.dynamis.panorama.api.ViewportBounds;
import io.dynamis.panorama.api.ViewerProjection;
import io.dynamis.panorama.geometry.EquirectangularProjection;
import io.dynamis.panorama.geometry.TileGrid;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes which tiles are visible from the current camera.
 *
 * ALGORITHM:
 *   1. Sample the (cols+1) x (rows+1) lattice of tile corners, not tile centers,
 *      so a tile is considered as soon as any one of its corners is on screen.
 *   2. Drop corners in the back hemisphere (dot with the view direction <= 0),
 *      then corners that project outside the viewport.
 *   3. For each surviving corner, take the angle to the view direction and the
 *      four tiles sharing that corner (pole and seam wrapped).
 *   4. Merge by tile id keeping the smallest angle.
 *
 * The corner directions depend only on the grid, so they are computed once per
 * panorama and reused until a different config is passed in.
 *
 * THREAD SAFETY:
 *   The cached lattice is immutable and published through a volatile field;
 *   concurrent calls are safe, though the viewer normally calls this from one
 *   thread at most once per frame.
 */
public final class VisibilitySampler {

    private static final Logger logger = LoggerFactory.getLogger(VisibilitySampler.class);

    private volatile CornerLattice lattice;

    /** Number of on-screen corners found by the most recent call. */
    private volatile int lastVisibleCorners = 0;

    /**
     * @return one candidate per visible tile; order carries no meaning
     */
    public List<TileCandidate> computeVisibleTiles(CameraView view, PanoramaConfig config) {
        if (view == null) throw new NullPointerException("view");
        if (config == null) throw new NullPointerException("config");

        CornerLattice corners = latticeFor(config);
        Direction viewDirection = view.direction();
        ViewportBounds bounds = view.bounds();
        ViewerProjection projection = view.projection();

        Map<Tile, Double> minAngles = new LinkedHashMap<>();
        int visibleCorners = 0;

        for (int col = 0; col <= config.cols(); col++) {
            for (int row = 0; row <= config.rows(); row++) {
                Direction corner = corners.at(col, row);
                if (corner.dot(viewDirection) <= 0) continue;

                ScreenPoint screen = projection.project(corner);
                if (screen == null || !bounds.contains(screen)) continue;

                visibleCorners++;
                double angle = corner.angleTo(viewDirection);
                for (Tile tile : TileGrid.adjacentTiles(col, row, config)) {
                    minAngles.merge(tile, angle, Math::min);
                }
            }
        }

        List<TileCandidate> candidates = new ArrayList<>(minAngles.size());
        for (Map.Entry<Tile, Double> entry : minAngles.entrySet()) {
            candidates.add(new TileCandidate(entry.getKey(), entry.getValue()));
        }
        lastVisibleCorners = visibleCorners;
        logger.debug("{} visible corners -> {} candidate tiles", visibleCorners, candidates.size());
        return candidates;
    }

    /** Number of on-screen corners found by the most recent call. */
    public int lastVisibleCorners() {
        return lastVisibleCorners;
    }

    /** Drops the cached corner lattice. */
    public void reset() {
        lattice = null;
    }

    private CornerLattice latticeFor(PanoramaConfig config) {
        CornerLattice current = lattice;
        if (current == null || current.config != config) {
            current = new CornerLattice(config);
            lattice = current;
        }
        return current;
    }

    // -- Corner lattice -------------------------------------------------------

    /** Directions of all grid-line intersections of one panorama. Immutable. */
    private static final class CornerLattice {

        private final PanoramaConfig config;
        private final int rowStride;
        private final Direction[] directions;

        CornerLattice(PanoramaConfig config) {
            this.config = config;
            this.rowStride = config.rows() + 1;
            this.directions = new Direction[(config.cols() + 1) * rowStride];
            double colSize = config.colSize();
            double rowSize = config.rowSize();
            for (int col = 0; col <= config.cols(); col++) {
                for (int row = 0; row <= config.rows(); row++) {
                    directions[col * rowStride + row] =
                        EquirectangularProjection.textureCoordsToDirection(col * colSize, row * rowSize, config);
                }
            }
        }

        Direction at(int col, int row) {
            return directions[col * rowStride + row];
        }
    }
}
