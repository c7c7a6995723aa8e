package io.dynamis.panorama.api;

/**
 * Immutable description of one tiled panorama.
 *
 * Set once per panorama load. The full image is width x width/2 pixels, sliced
 * into cols x rows tiles. Tile fetch keys come from the resolver; an optional
 * base URL names a low resolution copy of the whole panorama that is drawn
 * before any tile arrives.
 *
 * VALIDATION:
 *   build() rejects a configuration before any tile work begins when
 *   width, cols or rows is missing or not positive, the resolver is missing,
 *   cols is not a multiple of 4 or rows is not a multiple of 2.
 *   The multiples keep every boundary of the 8-way canvas partition on a tile edge.
 */
public final class PanoramaConfig {

    private final int width;
    private final int cols;
    private final int rows;
    private final TileUrlResolver tileUrlResolver;
    private final String baseUrl;

    private PanoramaConfig(Builder builder) {
        this.width = builder.width;
        this.cols = builder.cols;
        this.rows = builder.rows;
        this.tileUrlResolver = builder.tileUrlResolver;
        this.baseUrl = builder.baseUrl;
    }

    /** Full panorama width in pixels. */
    public int width() { return width; }

    /** Full panorama height in pixels. Always width / 2. */
    public int height() { return width / TilingConstants.HEIGHT_RATIO; }

    /** Number of tile columns. Multiple of 4. */
    public int cols() { return cols; }

    /** Number of tile rows. Multiple of 2. */
    public int rows() { return rows; }

    /** Width of one tile in pixels. */
    public double colSize() { return (double) width / cols; }

    /** Height of one tile in pixels. */
    public double rowSize() { return (double) height() / rows; }

    /** Builds the fetch key of a tile. */
    public TileUrlResolver tileUrlResolver() { return tileUrlResolver; }

    /** Fetch key of the low resolution base image, or null if there is none. */
    public String baseUrl() { return baseUrl; }

    public boolean hasBaseUrl() { return baseUrl != null; }

    /** Shortcut for tileUrlResolver().resolve(tile.col(), tile.row()). */
    public String tileUrl(Tile tile) {
        return tileUrlResolver.resolve(tile.col(), tile.row());
    }

    @Override
    public String toString() {
        return "PanoramaConfig{width=" + width + ", cols=" + cols + ", rows=" + rows +
            ", baseUrl=" + (baseUrl == null ? "none" : "'" + baseUrl + "'") + "}";
    }

    // -- Validation -----------------------------------------------------------

    /**
     * Checks raw panorama parameters.
     *
     * @throws PanoramaConfigurationException naming the first invalid field
     */
    public static void validate(Integer width, Integer cols, Integer rows, TileUrlResolver resolver) {
        if (width == null || cols == null || rows == null || resolver == null) {
            throw new PanoramaConfigurationException(
                "Invalid panorama configuration: width, cols, rows and tileUrlResolver are required" +
                " (width=" + width + ", cols=" + cols + ", rows=" + rows +
                ", tileUrlResolver=" + (resolver == null ? "missing" : "present") + ")");
        }
        if (width <= 0) {
            throw new PanoramaConfigurationException("Panorama width must be > 0; got " + width);
        }
        if (cols <= 0 || rows <= 0) {
            throw new PanoramaConfigurationException(
                "Panorama cols and rows must be > 0; got cols=" + cols + ", rows=" + rows);
        }
        if (cols % TilingConstants.COLUMN_MULTIPLE != 0 || rows % TilingConstants.ROW_MULTIPLE != 0) {
            throw new PanoramaConfigurationException(
                "Panorama cols must be multiple of " + TilingConstants.COLUMN_MULTIPLE +
                " and rows must be multiple of " + TilingConstants.ROW_MULTIPLE +
                "; got cols=" + cols + ", rows=" + rows);
        }
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Integer width;
        private Integer cols;
        private Integer rows;
        private TileUrlResolver tileUrlResolver;
        private String baseUrl;

        private Builder() {}

        public Builder width(int width) { this.width = width; return this; }
        public Builder cols(int cols) { this.cols = cols; return this; }
        public Builder rows(int rows) { this.rows = rows; return this; }
        public Builder tileUrlResolver(TileUrlResolver resolver) { this.tileUrlResolver = resolver; return this; }

        /** Optional low resolution panorama drawn before tiles. Blank values are ignored. */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? null : baseUrl;
            return this;
        }

        /**
         * @throws PanoramaConfigurationException if the parameters are invalid
         */
        public PanoramaConfig build() {
            validate(width, cols, rows, tileUrlResolver);
            return new PanoramaConfig(this);
        }
    }
}
